package com.gillianbc.lifemodel.model.benefit;

public enum AnnuityType {
    FIXED("Fixed"),
    VARIABLE("Variable"),
    IMMEDIATE("Immediate"),
    DEFERRED("Deferred");

    private final String label;

    AnnuityType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
