package com.fairway.tenant.health;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Service-level observations for one tenant.
 *
 * @param uptime             fraction of time available, in [0, 1]
 * @param errorRate          fraction of failed requests, in [0, 1]
 * @param satisfactionRating average customer rating, in [0, 5]
 * @param observedAt         when the observations were taken
 */
public record SloSnapshot(BigDecimal uptime, BigDecimal errorRate, BigDecimal satisfactionRating,
                          Instant observedAt) {

    private static final BigDecimal MAX_RATING = BigDecimal.valueOf(5);

    public SloSnapshot {
        requireWithin("uptime", uptime, BigDecimal.ONE);
        requireWithin("errorRate", errorRate, BigDecimal.ONE);
        requireWithin("satisfactionRating", satisfactionRating, MAX_RATING);
    }

    private static void requireWithin(String field, BigDecimal value, BigDecimal max) {
        if (value == null || value.signum() < 0 || value.compareTo(max) > 0) {
            throw new IllegalArgumentException(field + " must be within [0, " + max + "]");
        }
    }
}
