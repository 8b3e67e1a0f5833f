package com.fairway.revenue.anomaly;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A deviation found in the ledger.
 *
 * @param id                 deterministic id
 * @param detectedAt         snapshot time the detection ran against
 * @param anomalyType        kind
 * @param severity           severity band
 * @param description        human-readable summary
 * @param affectedRevenue    signed deviation from the baseline mean, or the contribution of the
 *                           inconsistent event
 * @param possibleCauses     event types that moved most, largest first
 * @param recommendedActions follow-up actions
 * @param tenantId           tenant, or null for platform-wide
 * @param day                UTC day the anomaly was found in
 * @param zScore             z-score of the bucket, null where no baseline applies
 */
public record RevenueAnomaly(
        UUID id,
        Instant detectedAt,
        AnomalyType anomalyType,
        AnomalySeverity severity,
        String description,
        BigDecimal affectedRevenue,
        List<String> possibleCauses,
        List<String> recommendedActions,
        String tenantId,
        LocalDate day,
        BigDecimal zScore) {

    public RevenueAnomaly {
        possibleCauses = List.copyOf(possibleCauses);
        recommendedActions = List.copyOf(recommendedActions);
    }
}
