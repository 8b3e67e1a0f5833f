package com.fairway.tenant.health;

import java.math.BigDecimal;

/**
 * One weighted input of a health score.
 *
 * @param name         display name, e.g. "Uptime"
 * @param weight       share of the score, the weights of a score summing to 1
 * @param value        normalized value in [0, 1], higher is healthier
 * @param contribution points added to the score: weight × value × 100, four decimals
 */
public record HealthFactor(String name, BigDecimal weight, BigDecimal value, BigDecimal contribution) {
}
