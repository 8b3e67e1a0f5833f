package com.fairway.revenue.growth;

import com.fairway.revenue.period.RevenuePeriod;

import java.math.BigDecimal;
import java.util.List;

/**
 * Net revenue of two comparable calendar periods.
 *
 * @param growthRate        (current − previous) / |previous|, zero when undefined
 * @param growthRateDefined false when the previous net is zero
 */
public record PeriodComparison(
        String tenantId,
        RevenuePeriod current,
        RevenuePeriod previous,
        BigDecimal currentNet,
        BigDecimal previousNet,
        BigDecimal growthRate,
        boolean growthRateDefined,
        List<GrowthDriver> drivers) {

    public PeriodComparison {
        drivers = List.copyOf(drivers);
    }
}
