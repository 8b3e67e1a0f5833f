package com.fairway.tenant.health;

import java.math.BigDecimal;

/**
 * Movement of one factor since the previous score of the same tenant.
 *
 * @param factor    factor name
 * @param direction improving, stable or declining
 * @param change    current value minus previous value
 */
public record HealthTrend(String factor, HealthTrendDirection direction, BigDecimal change) {
}
