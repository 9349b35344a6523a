package com.gillianbc.lifemodel.model.charity;

public enum DonationType {
    CASH("Cash"),
    STOCK("Stock"),
    PROPERTY("Property"),
    OTHER("Other");

    private final String label;

    DonationType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
