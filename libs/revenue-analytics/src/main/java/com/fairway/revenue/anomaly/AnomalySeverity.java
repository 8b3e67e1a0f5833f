package com.fairway.revenue.anomaly;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Severity bands on the absolute z-score of a daily bucket against its baseline.
 */
public enum AnomalySeverity {
    LOW("low", new BigDecimal("2")),
    MEDIUM("medium", new BigDecimal("3")),
    HIGH("high", new BigDecimal("4")),
    CRITICAL("critical", new BigDecimal("5"));

    private final String value;
    private final BigDecimal minimumZScore;

    AnomalySeverity(String value, BigDecimal minimumZScore) {
        this.value = value;
        this.minimumZScore = minimumZScore;
    }

    public String value() {
        return value;
    }

    public BigDecimal minimumZScore() {
        return minimumZScore;
    }

    /**
     * Highest band whose threshold {@code |z|} reaches; empty below {@link #LOW}.
     */
    public static Optional<AnomalySeverity> forZScore(BigDecimal z) {
        BigDecimal magnitude = z.abs();
        AnomalySeverity result = null;
        for (AnomalySeverity severity : values()) {
            if (magnitude.compareTo(severity.minimumZScore) >= 0) {
                result = severity;
            }
        }
        return Optional.ofNullable(result);
    }

    public boolean isAtLeast(AnomalySeverity other) {
        return compareTo(other) >= 0;
    }
}
