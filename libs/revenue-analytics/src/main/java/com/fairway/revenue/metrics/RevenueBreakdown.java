package com.fairway.revenue.metrics;

import com.fairway.eventmodel.DateRange;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Where revenue came from over a window.
 * <p>
 * Tier and region are read from event metadata ({@code tier}, {@code region}); events without
 * them are grouped under {@value #UNASSIGNED}. Channel is the event source. Map values are net
 * contributions.
 */
public record RevenueBreakdown(
        String tenantId,
        DateRange range,
        String currency,
        BigDecimal subscriptionRevenue,
        BigDecimal usageBasedRevenue,
        BigDecimal oneTimeCharges,
        BigDecimal setupFees,
        BigDecimal addOnRevenue,
        BigDecimal refundsAndCredits,
        SortedMap<String, BigDecimal> revenueByTier,
        SortedMap<String, BigDecimal> revenueByRegion,
        SortedMap<String, BigDecimal> revenueByChannel) {

    public static final String UNASSIGNED = "unassigned";

    public RevenueBreakdown {
        revenueByTier = copy(revenueByTier);
        revenueByRegion = copy(revenueByRegion);
        revenueByChannel = copy(revenueByChannel);
    }

    private static SortedMap<String, BigDecimal> copy(Map<String, BigDecimal> source) {
        return Collections.unmodifiableSortedMap(new TreeMap<>(source));
    }
}
