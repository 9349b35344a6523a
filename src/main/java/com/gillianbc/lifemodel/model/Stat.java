package com.gillianbc.lifemodel.model;

/**
 * Named yearly statistics reported by simulated entities and summed across them.
 */
public enum Stat {
    GROSS_INCOME("Income"),
    BANK_BALANCE("Bank Balance"),
    RETIREMENT_BALANCE("401k Balance"),
    USABLE_BALANCE("Useable Balance"),
    DEBT("Debt"),
    TAXES_PAID("Taxes"),
    TAXES_PAID_FEDERAL("Federal Taxes"),
    TAXES_PAID_STATE("State Taxes"),
    TAXES_PAID_SS("Social Security Taxes"),
    TAXES_PAID_MEDICARE("Medicare Taxes"),
    MONEY_SPENT("Spending"),
    RETIREMENT_CONTRIB("401k Contrib"),
    RETIREMENT_MATCH("401k Match"),
    REQUIRED_MIN_DISTRIB("RMDs"),
    HOME_EXPENSES("Home Expenses"),
    INTEREST_PAID("Interest Paid"),
    RENT_PAID("Rent Paid"),
    SOCIAL_SECURITY_INCOME("Social Security"),
    DONATIONS("Donations");

    private final String title;

    Stat(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }
}
