package com.fairway.revenue.period;

import java.util.Optional;

/** Bucket size of a {@link RevenuePeriod}. */
public enum Granularity {
    DAILY("daily", "Daily"),
    WEEKLY("weekly", "Weekly"),
    MONTHLY("monthly", "Monthly"),
    QUARTERLY("quarterly", "Quarterly"),
    YEARLY("yearly", "Yearly"),
    CUSTOM("custom", "Custom");

    private final String value;
    private final String displayName;

    Granularity(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    public String value() {
        return value;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<Granularity> fromString(String value) {
        for (Granularity g : values()) {
            if (g.value.equalsIgnoreCase(value)) {
                return Optional.of(g);
            }
        }
        return Optional.empty();
    }
}
