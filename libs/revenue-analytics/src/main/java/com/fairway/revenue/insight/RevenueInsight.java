package com.fairway.revenue.insight;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An actionable observation derived from metrics, growth, anomalies and forecasts.
 *
 * @param potentialValue money at stake, null when the rule cannot estimate it
 * @param confidence     in [0, 1]
 * @param createdAt      snapshot time
 * @param expiresAt      time after which the insight should be regenerated
 */
public record RevenueInsight(
        UUID id,
        String tenantId,
        String title,
        String description,
        InsightType insightType,
        ImpactLevel impact,
        String recommendation,
        BigDecimal potentialValue,
        BigDecimal confidence,
        Instant createdAt,
        Instant expiresAt) {
}
