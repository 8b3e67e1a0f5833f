package com.fairway.tenant.health;

import java.math.BigDecimal;

public enum HealthTrendDirection {

    IMPROVING("improving"),
    STABLE("stable"),
    DECLINING("declining");

    /** Changes of a factor value within this band count as stable. */
    public static final BigDecimal STABLE_BAND = new BigDecimal("0.005");

    private final String value;

    HealthTrendDirection(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static HealthTrendDirection forChange(BigDecimal change) {
        if (change.compareTo(STABLE_BAND) > 0) {
            return IMPROVING;
        }
        if (change.compareTo(STABLE_BAND.negate()) < 0) {
            return DECLINING;
        }
        return STABLE;
    }
}
