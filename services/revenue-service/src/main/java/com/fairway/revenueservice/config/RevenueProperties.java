package com.fairway.revenueservice.config;

import com.fairway.common.BoundedCall;
import com.fairway.revenue.RevenueFeatures;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Analytics and governance settings, bound once at startup from {@code fairway.revenue.*}.
 *
 * <pre>
 * fairway:
 *   revenue:
 *     collaborator-timeout: 5s
 *     batch-parallelism: 4
 *     features:
 *       anomaly-detection: true
 *       benchmarking: false
 *     slo:
 *       uptime: 0.999
 * </pre>
 *
 * @param collaboratorTimeout timeout for encoders, the SLO feed and data migrators
 * @param batchParallelism    worker threads for batch jobs
 * @param features            feature toggles
 * @param slo                 service-level figures reported for every tenant until a monitoring feed is wired
 */
@ConfigurationProperties(prefix = "fairway.revenue")
@Validated
public record RevenueProperties(
        Duration collaboratorTimeout,
        @Min(1) int batchParallelism,
        @Valid Features features,
        @Valid Slo slo) {

    public RevenueProperties {
        if (collaboratorTimeout == null || collaboratorTimeout.isZero() || collaboratorTimeout.isNegative()) {
            collaboratorTimeout = BoundedCall.DEFAULT_TIMEOUT;
        }
        if (batchParallelism <= 0) {
            batchParallelism = 4;
        }
        if (features == null) {
            features = Features.fromDefaults();
        }
        if (slo == null) {
            slo = new Slo(null, null, null);
        }
    }

    /**
     * Toggles; every feature except benchmarking is on unless configured otherwise.
     */
    public record Features(
            @DefaultValue("true") boolean anomalyDetection,
            @DefaultValue("true") boolean forecasting,
            @DefaultValue("true") boolean realtimeUpdates,
            @DefaultValue("true") boolean caching,
            @DefaultValue("true") boolean encryption,
            @DefaultValue("true") boolean auditLogging,
            @DefaultValue("false") boolean benchmarking,
            @DefaultValue("true") boolean insightGeneration) {

        static Features fromDefaults() {
            RevenueFeatures defaults = RevenueFeatures.defaults();
            return new Features(defaults.anomalyDetection(), defaults.forecasting(), defaults.realtimeUpdates(),
                    defaults.caching(), defaults.encryption(), defaults.auditLogging(), defaults.benchmarking(),
                    defaults.insightGeneration());
        }

        public RevenueFeatures toRevenueFeatures() {
            return new RevenueFeatures(anomalyDetection, forecasting, realtimeUpdates, caching, encryption,
                    auditLogging, benchmarking, insightGeneration);
        }
    }

    /**
     * @param uptime             fraction in [0, 1], 0.999 when unset
     * @param errorRate          fraction in [0, 1], 0.001 when unset
     * @param satisfactionRating rating in [0, 5], 4.5 when unset
     */
    public record Slo(
            @DecimalMin("0") @DecimalMax("1") BigDecimal uptime,
            @DecimalMin("0") @DecimalMax("1") BigDecimal errorRate,
            @DecimalMin("0") @DecimalMax("5") BigDecimal satisfactionRating) {

        public Slo {
            if (uptime == null) {
                uptime = new BigDecimal("0.999");
            }
            if (errorRate == null) {
                errorRate = new BigDecimal("0.001");
            }
            if (satisfactionRating == null) {
                satisfactionRating = new BigDecimal("4.5");
            }
        }
    }
}
