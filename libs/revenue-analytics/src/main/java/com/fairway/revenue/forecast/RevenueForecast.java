package com.fairway.revenue.forecast;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

/**
 * Predicted net revenue for one future month under one scenario.
 *
 * @param id                 deterministic id derived from tenant, month, scenario and ledger version
 * @param tenantId           tenant, or null for platform-wide
 * @param month              predicted month
 * @param monthsAhead        horizon, 1 for the current month
 * @param scenario           scenario
 * @param predictedRevenue   predicted net revenue, never negative
 * @param confidenceInterval interval and confidence
 * @param factors            contributing factors
 * @param generatedAt        snapshot time the forecast was computed from
 */
public record RevenueForecast(
        UUID id,
        String tenantId,
        YearMonth month,
        int monthsAhead,
        ForecastScenario scenario,
        BigDecimal predictedRevenue,
        ConfidenceInterval confidenceInterval,
        List<ForecastFactor> factors,
        Instant generatedAt) {

    public RevenueForecast {
        factors = List.copyOf(factors);
    }
}
