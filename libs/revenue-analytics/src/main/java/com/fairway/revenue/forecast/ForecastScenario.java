package com.fairway.revenue.forecast;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Forecast scenario. Non-realistic scenarios shift the fitted trend by a multiple of the
 * series' volatility.
 */
public enum ForecastScenario {
    CONSERVATIVE("conservative", new BigDecimal("-0.5")),
    REALISTIC("realistic", BigDecimal.ZERO),
    OPTIMISTIC("optimistic", new BigDecimal("0.5"));

    private final String value;
    private final BigDecimal volatilityMultiplier;

    ForecastScenario(String value, BigDecimal volatilityMultiplier) {
        this.value = value;
        this.volatilityMultiplier = volatilityMultiplier;
    }

    public String value() {
        return value;
    }

    /** Offset applied to the trend, in units of σ. */
    public BigDecimal volatilityMultiplier() {
        return volatilityMultiplier;
    }

    public static Optional<ForecastScenario> fromString(String value) {
        for (ForecastScenario s : values()) {
            if (s.value.equalsIgnoreCase(value)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
