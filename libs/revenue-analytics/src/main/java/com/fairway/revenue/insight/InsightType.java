package com.fairway.revenue.insight;

public enum InsightType {
    OPTIMIZATION("optimization"),
    WARNING("warning"),
    OPPORTUNITY("opportunity"),
    TREND("trend"),
    PREDICTION("prediction");

    private final String value;

    InsightType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
