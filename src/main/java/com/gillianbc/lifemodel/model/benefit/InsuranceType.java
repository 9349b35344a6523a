package com.gillianbc.lifemodel.model.benefit;

public enum InsuranceType {
    AUTO("Auto"),
    HOME("Home"),
    HEALTH("Health"),
    DISABILITY("Disability"),
    UMBRELLA("Umbrella");

    private final String label;

    InsuranceType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
