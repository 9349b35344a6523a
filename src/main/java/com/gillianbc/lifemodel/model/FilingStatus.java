package com.gillianbc.lifemodel.model;

/**
 * Tax filing status. The config key is used to look up status-specific tables.
 */
public enum FilingStatus {
    SINGLE("single"),
    MARRIED_FILING_JOINTLY("married_filing_jointly");

    private final String configKey;

    FilingStatus(String configKey) {
        this.configKey = configKey;
    }

    public String configKey() {
        return configKey;
    }
}
