package com.fairway.revenue.growth;

import java.math.BigDecimal;

/**
 * A revenue bucket's share of the quarter-over-quarter change.
 *
 * @param name         bucket name: recurring, usage, one_time or refunds
 * @param contribution change of the bucket's effect on net revenue, relative to the previous
 *                     quarter's net
 * @param trend        classification of the bucket's recent monthly growth
 * @param description  human-readable summary
 */
public record GrowthDriver(String name, BigDecimal contribution, GrowthTrend trend, String description) {
}
