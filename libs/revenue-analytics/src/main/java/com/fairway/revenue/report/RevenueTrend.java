package com.fairway.revenue.report;

import com.fairway.revenue.period.RevenuePeriod;

import java.math.BigDecimal;

/**
 * Movement of one metric between a report's period and the period before it.
 *
 * @param metric       metric name, e.g. {@code net_revenue}
 * @param direction    direction of the change
 * @param magnitude    relative change, (current − previous) / |previous|
 * @param period       the report period
 * @param significance share of the report's gross revenue the change represents, in [0, 1]
 */
public record RevenueTrend(String metric, TrendDirection direction, BigDecimal magnitude,
                           RevenuePeriod period, BigDecimal significance) {
}
