package com.gillianbc.lifemodel.simulation;

import com.gillianbc.lifemodel.model.account.BankAccount;
import com.gillianbc.lifemodel.model.account.BrokerageAccount;
import com.gillianbc.lifemodel.model.account.HealthSavingsAccount;
import com.gillianbc.lifemodel.model.account.Plan529;
import com.gillianbc.lifemodel.model.account.RetirementAccount;
import com.gillianbc.lifemodel.model.benefit.Annuity;
import com.gillianbc.lifemodel.model.benefit.Insurance;
import com.gillianbc.lifemodel.model.benefit.Pension;
import com.gillianbc.lifemodel.model.benefit.SocialSecurity;
import com.gillianbc.lifemodel.model.benefit.TermLifeInsurance;
import com.gillianbc.lifemodel.model.charity.Donation;
import com.gillianbc.lifemodel.model.charity.DonorAdvisedFund;
import com.gillianbc.lifemodel.model.debt.Loan;
import com.gillianbc.lifemodel.model.housing.Apartment;
import com.gillianbc.lifemodel.model.housing.Home;
import com.gillianbc.lifemodel.model.work.Job;
import lombok.Getter;

/**
 * The registries a model keeps, one per kind of owned entity.
 */
@Getter
public class ModelRegistries {

    private final Registry<BankAccount> bankAccounts = new Registry<>();
    private final Registry<Job> jobs = new Registry<>();
    private final Registry<RetirementAccount> retirementAccounts = new Registry<>();
    private final Registry<BrokerageAccount> investments = new Registry<>();
    private final Registry<Home> homes = new Registry<>();
    private final Registry<Apartment> apartments = new Registry<>();
    private final Registry<Loan> loans = new Registry<>();
    private final Registry<Insurance> insurancePolicies = new Registry<>();
    private final Registry<Pension> pensions = new Registry<>();
    private final Registry<SocialSecurity> socialSecurity = new Registry<>();
    private final Registry<Annuity> annuities = new Registry<>();
    private final Registry<TermLifeInsurance> lifeInsurancePolicies = new Registry<>();
    private final Registry<HealthSavingsAccount> healthSavingsAccounts = new Registry<>();
    private final Registry<Plan529> plan529s = new Registry<>();
    private final Registry<Donation> donations = new Registry<>();
    private final Registry<DonorAdvisedFund> donorAdvisedFunds = new Registry<>();

    public void clearAll() {
        bankAccounts.clearAll();
        jobs.clearAll();
        retirementAccounts.clearAll();
        investments.clearAll();
        homes.clearAll();
        apartments.clearAll();
        loans.clearAll();
        insurancePolicies.clearAll();
        pensions.clearAll();
        socialSecurity.clearAll();
        annuities.clearAll();
        lifeInsurancePolicies.clearAll();
        healthSavingsAccounts.clearAll();
        plan529s.clearAll();
        donations.clearAll();
        donorAdvisedFunds.clearAll();
    }
}
