package com.fairway.revenue.metrics;

import com.fairway.revenue.period.RevenuePeriod;

/**
 * Totals of one bucket of a series.
 */
public record PeriodTotals(RevenuePeriod period, RevenueTotals totals) {
}
