package com.gillianbc.lifemodel.model.account;

/**
 * Coverage tier of a health savings account; selects the yearly contribution limit.
 */
public enum HsaType {
    INDIVIDUAL("individual"),
    FAMILY("family");

    private final String configKey;

    HsaType(String configKey) {
        this.configKey = configKey;
    }

    public String configKey() {
        return configKey;
    }
}
