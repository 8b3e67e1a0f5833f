package com.fairway.revenue.insight;

public enum ImpactLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    ImpactLevel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
