package com.fairway.revenue.anomaly;

import java.util.Optional;

public enum AnomalyType {
    SUDDEN_DROP("sudden_drop"),
    SUDDEN_SPIKE("sudden_spike"),
    UNUSUAL_PATTERN("unusual_pattern"),
    MISSING_DATA("missing_data"),
    DATA_INCONSISTENCY("data_inconsistency");

    private final String value;

    AnomalyType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<AnomalyType> fromString(String value) {
        for (AnomalyType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
