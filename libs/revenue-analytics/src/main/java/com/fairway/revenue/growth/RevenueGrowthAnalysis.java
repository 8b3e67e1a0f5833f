package com.fairway.revenue.growth;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Growth picture of one tenant (or the platform) as of a snapshot.
 *
 * @param tenantId                  tenant, or null for platform-wide
 * @param asOf                      snapshot time
 * @param currentGrowthRate         growth of the last complete month over the one before
 * @param quarterOverQuarterGrowth  last complete quarter over the previous quarter
 * @param yearOverYearGrowth        last complete quarter over the same quarter a year earlier
 * @param growthTrend               classification of {@code monthlyGrowthRates}
 * @param growthDrivers             bucket contributions, largest first
 * @param projectedGrowth           expected growth of the next month
 * @param benchmarkComparison       null unless benchmarking is enabled
 * @param monthlyGrowthRates        defined monthly growth rates, oldest first
 */
public record RevenueGrowthAnalysis(
        String tenantId,
        Instant asOf,
        BigDecimal currentGrowthRate,
        BigDecimal quarterOverQuarterGrowth,
        BigDecimal yearOverYearGrowth,
        GrowthTrend growthTrend,
        List<GrowthDriver> growthDrivers,
        BigDecimal projectedGrowth,
        BenchmarkComparison benchmarkComparison,
        List<BigDecimal> monthlyGrowthRates) {

    public RevenueGrowthAnalysis {
        growthDrivers = List.copyOf(growthDrivers);
        monthlyGrowthRates = List.copyOf(monthlyGrowthRates);
    }
}
