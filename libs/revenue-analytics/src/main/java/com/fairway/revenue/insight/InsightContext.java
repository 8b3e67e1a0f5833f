package com.fairway.revenue.insight;

import com.fairway.revenue.anomaly.RevenueAnomaly;
import com.fairway.revenue.forecast.RevenueForecast;
import com.fairway.revenue.growth.RevenueGrowthAnalysis;
import com.fairway.revenue.metrics.RevenueMetrics;

import java.time.Instant;
import java.util.List;

/**
 * Everything the insight rules look at. Parts that could not be computed are null or empty and
 * the rules that need them stay silent.
 *
 * @param tenantId      tenant, or null for platform-wide
 * @param asOf          snapshot time
 * @param ledgerVersion snapshot version the inputs were computed from
 * @param metrics       metrics of the last complete month
 * @param growth        growth analysis
 * @param anomalies     anomalies of the recent window
 * @param forecasts     forecasts, any scenarios
 */
public record InsightContext(
        String tenantId,
        Instant asOf,
        long ledgerVersion,
        RevenueMetrics metrics,
        RevenueGrowthAnalysis growth,
        List<RevenueAnomaly> anomalies,
        List<RevenueForecast> forecasts) {

    public InsightContext {
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
        forecasts = forecasts == null ? List.of() : List.copyOf(forecasts);
    }
}
