package com.fairway.revenue.metrics;

import com.fairway.revenue.period.RevenuePeriod;

import java.math.BigDecimal;

/**
 * Per-tenant revenue summary for one period.
 */
public record TenantRevenue(
        String tenantId,
        String tenantName,
        RevenuePeriod period,
        BigDecimal totalRevenue,
        BigDecimal subscriptionRevenue,
        BigDecimal usageRevenue,
        BigDecimal refunds,
        BigDecimal netRevenue,
        long customerCount,
        BigDecimal averageRevenuePerCustomer,
        BigDecimal growthRate,
        boolean growthRateDefined) {

    public static TenantRevenue from(RevenueMetrics metrics, String tenantName) {
        return new TenantRevenue(metrics.tenantId(), tenantName, metrics.period(),
                metrics.totalRevenue(), metrics.recurringRevenue(), metrics.usageRevenue(),
                metrics.refunds(), metrics.netRevenue(), metrics.customerCount(),
                metrics.averageRevenuePerCustomer(), metrics.growthRate(), metrics.growthRateDefined());
    }
}
