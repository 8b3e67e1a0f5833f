package com.fairway.revenue.metrics;

import com.fairway.revenue.period.RevenuePeriod;

import java.math.BigDecimal;

/**
 * Revenue figures for one tenant (or the whole platform) over one period.
 *
 * <p>Contains no wall-clock fields: replaying the same events yields an equal record.
 *
 * @param tenantId                  tenant, or null for platform-wide figures
 * @param period                    the bucket measured
 * @param currency                  currency of all amounts, null when the window was empty
 * @param totalRevenue              gross revenue (recurring + usage + one-time)
 * @param recurringRevenue          subscription revenue net of downgrades
 * @param usageRevenue              usage charges
 * @param oneTimeRevenue            one-time payments, setup fees and add-ons
 * @param refunds                   refunds, chargebacks and credits (positive)
 * @param netRevenue                gross minus refunds
 * @param customerCount             distinct customers with a non-cancelling event
 * @param averageRevenuePerCustomer net revenue per customer
 * @param lifetimeValue             ARPC / churn, or ARPC × 12 when nothing churned
 * @param churnRate                 share of subscriptions active at the start that cancelled
 * @param growthRate                net revenue change versus the previous bucket
 * @param growthRateDefined         false when the previous bucket's net was zero
 * @param monthlyRecurringRevenue   recurring revenue normalized to one month
 * @param annualRecurringRevenue    recurring revenue normalized to one year
 * @param eventCount                events in the window
 * @param ledgerVersion             ledger version the figures were computed from
 */
public record RevenueMetrics(
        String tenantId,
        RevenuePeriod period,
        String currency,
        BigDecimal totalRevenue,
        BigDecimal recurringRevenue,
        BigDecimal usageRevenue,
        BigDecimal oneTimeRevenue,
        BigDecimal refunds,
        BigDecimal netRevenue,
        long customerCount,
        BigDecimal averageRevenuePerCustomer,
        BigDecimal lifetimeValue,
        BigDecimal churnRate,
        BigDecimal growthRate,
        boolean growthRateDefined,
        BigDecimal monthlyRecurringRevenue,
        BigDecimal annualRecurringRevenue,
        long eventCount,
        long ledgerVersion) {
}
