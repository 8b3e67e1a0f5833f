package com.fairway.revenue.signal;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;

/**
 * Platform-wide running figures for the current calendar month.
 *
 * @param totalRevenue            net revenue recorded in the month so far
 * @param monthlyRecurringRevenue recurring revenue of the month
 * @param annualRecurringRevenue  MRR × 12
 * @param churnRate               cancellations in the month among subscriptions active at its start
 * @param month                   the month the figures belong to
 * @param sequence                ledger sequence of the last applied event, 0 after a reseed with no
 *                                appends
 * @param updatedAt               time of the last update
 */
public record RevenueSignals(
        BigDecimal totalRevenue,
        BigDecimal monthlyRecurringRevenue,
        BigDecimal annualRecurringRevenue,
        BigDecimal churnRate,
        YearMonth month,
        long sequence,
        Instant updatedAt) {
}
