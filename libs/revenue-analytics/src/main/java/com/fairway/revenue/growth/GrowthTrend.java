package com.fairway.revenue.growth;

import java.util.Optional;

public enum GrowthTrend {
    ACCELERATING("accelerating"),
    STEADY("steady"),
    DECLINING("declining"),
    VOLATILE("volatile");

    private final String value;

    GrowthTrend(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<GrowthTrend> fromString(String value) {
        for (GrowthTrend trend : values()) {
            if (trend.value.equalsIgnoreCase(value)) {
                return Optional.of(trend);
            }
        }
        return Optional.empty();
    }
}
