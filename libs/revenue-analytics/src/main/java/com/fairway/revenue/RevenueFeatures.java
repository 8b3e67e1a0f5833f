package com.fairway.revenue;

/**
 * Feature toggles, read once at startup.
 * <p>
 * A disabled feature short-circuits: detection, forecasting and insight calls return empty
 * lists, caching is bypassed, signals stop updating and the audit trail stays silent. Results
 * of the operations that do run are the same either way.
 */
public record RevenueFeatures(
        boolean anomalyDetection,
        boolean forecasting,
        boolean realtimeUpdates,
        boolean caching,
        boolean encryption,
        boolean auditLogging,
        boolean benchmarking,
        boolean insightGeneration
) {

    /** Everything on except benchmarking. */
    public static RevenueFeatures defaults() {
        return new RevenueFeatures(true, true, true, true, true, true, false, true);
    }

    public static RevenueFeatures allDisabled() {
        return new RevenueFeatures(false, false, false, false, false, false, false, false);
    }

    public RevenueFeatures withBenchmarking(boolean enabled) {
        return new RevenueFeatures(anomalyDetection, forecasting, realtimeUpdates, caching,
                encryption, auditLogging, enabled, insightGeneration);
    }

    public RevenueFeatures withCaching(boolean enabled) {
        return new RevenueFeatures(anomalyDetection, forecasting, realtimeUpdates, enabled,
                encryption, auditLogging, benchmarking, insightGeneration);
    }
}
