package com.gillianbc.lifemodel.service;

import com.gillianbc.lifemodel.model.people.Person;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Pays a person's bills in a fixed order:
 * <ol>
 *     <li>bank accounts, in registration order</li>
 *     <li>Roth balances of retirement accounts, in registration order</li>
 * </ol>
 * Pre-tax balances are never touched here; they are only liquidated by settlement so the
 * withdrawal is counted as income.
 */
@Slf4j
@Service
public class PaymentService {

    /**
     * @return the part of {@code amount} that could not be paid
     */
    public BigDecimal payBills(Person person, BigDecimal amount) {
        Objects.requireNonNull(person, "person must not be null");
        Objects.requireNonNull(amount, "amount must not be null");
        if (amount.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal remaining = person.deductFromBankAccounts(amount);
        if (remaining.signum() == 0) {
            return BigDecimal.ZERO;
        }
        remaining = person.deductFromRoth(remaining);
        if (remaining.signum() > 0) {
            log.debug("{} could not pay {} of {}", person.getName(), remaining, amount);
        }
        return remaining;
    }
}
