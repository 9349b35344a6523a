package com.gillianbc.lifemodel.model.work;

import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.account.Job401kAccount;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.simulation.LifeModelAgent;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Employment paying a salary and bonus, optionally sponsoring a 401k.
 * <p>
 * In the pre-step phase the year's pay is posted: 401k contributions are taken from the base
 * salary (pre-tax first, then Roth, together capped by the yearly limit for the owner's age),
 * take-home pay goes to the bank and gross pay less the pre-tax contribution becomes taxable income.
 * Gross pay is also recorded as Social Security earnings when the owner has a benefit record.
 */
@Getter
public class Job extends LifeModelAgent {

    private final Person owner;
    private final String company;
    private final String role;
    private final Salary salary;
    private Job401kAccount retirementAccount;
    private boolean retired;

    public Job(Person owner, String company, String role, Salary salary) {
        super(owner.getModel());
        this.owner = owner;
        this.company = Objects.requireNonNull(company, "company must not be null");
        this.role = Objects.requireNonNull(role, "role must not be null");
        this.salary = Objects.requireNonNull(salary, "salary must not be null");
        getModel().getRegistries().getJobs().register(owner, this);
    }

    public Optional<Job401kAccount> getRetirementAccount() {
        return Optional.ofNullable(retirementAccount);
    }

    public void setRetirementAccount(Job401kAccount retirementAccount) {
        this.retirementAccount = retirementAccount;
    }

    /**
     * Ends the job. Any 401k stays with the owner.
     */
    public void retire() {
        if (retired) {
            return;
        }
        retired = true;
        if (retirementAccount != null) {
            retirementAccount.orphan();
            retirementAccount = null;
        }
        getModel().logEvent(owner.getName() + " retired from " + company);
    }

    @Override
    public void preStep() {
        if (retired) {
            return;
        }
        BigDecimal base = salary.getBase();
        BigDecimal remainingLimit = Money.min(base, getModel().getConfig().getJob401kContribLimit(owner.getAge()));
        BigDecimal pretax = BigDecimal.ZERO;
        BigDecimal roth = BigDecimal.ZERO;
        BigDecimal match = BigDecimal.ZERO;

        if (retirementAccount != null) {
            pretax = Money.min(remainingLimit, retirementAccount.pretaxContribution(base));
            remainingLimit = remainingLimit.subtract(pretax);
            roth = Money.min(remainingLimit, retirementAccount.rothContribution(base));
            match = retirementAccount.companyMatch(pretax.add(roth));
            retirementAccount.contribute(pretax, roth, match);
        }

        BigDecimal contributions = pretax.add(roth);
        BigDecimal gross = base.add(salary.getBonus());
        owner.depositIntoBankAccount(gross.subtract(contributions));
        owner.addTaxableIncome(gross.subtract(pretax));
        int year = getModel().getYear();
        owner.getSocialSecurity().ifPresent(socialSecurity -> socialSecurity.addEarnings(year, gross));

        recordStat(Stat.GROSS_INCOME, gross);
        recordStat(Stat.RETIREMENT_CONTRIB, contributions);
        recordStat(Stat.RETIREMENT_MATCH, match);
    }

    @Override
    public void postStep() {
        if (!retired) {
            salary.advanceYear();
        }
    }
}
