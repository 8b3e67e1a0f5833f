package com.fairway.revenue;

import com.fairway.common.ErrorKind;
import com.fairway.common.batch.BatchResult;
import com.fairway.common.batch.BatchRunner;
import com.fairway.eventmodel.DateRange;
import com.fairway.eventmodel.RevenueEvent;
import com.fairway.revenue.anomaly.AnomalyDetector;
import com.fairway.revenue.anomaly.RevenueAnomaly;
import com.fairway.revenue.forecast.ForecastEngine;
import com.fairway.revenue.forecast.ForecastScenario;
import com.fairway.revenue.forecast.RevenueForecast;
import com.fairway.revenue.growth.GrowthAnalyzer;
import com.fairway.revenue.growth.PeriodComparison;
import com.fairway.revenue.growth.RevenueGrowthAnalysis;
import com.fairway.revenue.insight.InsightContext;
import com.fairway.revenue.insight.InsightGenerator;
import com.fairway.revenue.insight.RevenueInsight;
import com.fairway.revenue.ledger.LedgerSnapshot;
import com.fairway.revenue.ledger.RevenueEventStore;
import com.fairway.revenue.metrics.MetricsAggregator;
import com.fairway.revenue.metrics.RevenueBreakdown;
import com.fairway.revenue.metrics.RevenueMetrics;
import com.fairway.revenue.metrics.TenantRevenue;
import com.fairway.revenue.period.Granularity;
import com.fairway.revenue.period.RevenuePeriod;
import com.fairway.revenue.report.EncodedDocument;
import com.fairway.revenue.report.ExportFormat;
import com.fairway.revenue.report.ReportAssembler;
import com.fairway.revenue.report.ReportFormat;
import com.fairway.revenue.report.RevenueReport;
import com.fairway.revenue.signal.RevenueSignalListener;
import com.fairway.revenue.signal.RevenueSignalPublisher;
import com.fairway.revenue.signal.RevenueSignals;
import com.fairway.revenue.signal.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Query and command surface of revenue analytics.
 *
 * <p>Every query reads one ledger snapshot, so its parts agree with each other. A {@code null}
 * tenant id means platform-wide; any other id must be known to the {@link TenantDirectory}.
 * Disabled features short-circuit: forecasts, anomalies and insights come back empty.
 */
public class RevenueAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(RevenueAnalyticsService.class);

    /** Window scanned for anomalies when the caller gives none. */
    public static final Duration DEFAULT_ANOMALY_WINDOW = Duration.ofDays(30);
    public static final int INSIGHT_FORECAST_MONTHS = 1;

    private final RevenueEventStore store;
    private final MetricsAggregator aggregator;
    private final ForecastEngine forecastEngine;
    private final AnomalyDetector anomalyDetector;
    private final GrowthAnalyzer growthAnalyzer;
    private final InsightGenerator insightGenerator;
    private final ReportAssembler reportAssembler;
    private final RevenueSignalPublisher signalPublisher;
    private final BatchRunner batchRunner;
    private final TenantDirectory tenants;
    private final RevenueFeatures features;

    public RevenueAnalyticsService(
            RevenueEventStore store,
            MetricsAggregator aggregator,
            ForecastEngine forecastEngine,
            AnomalyDetector anomalyDetector,
            GrowthAnalyzer growthAnalyzer,
            InsightGenerator insightGenerator,
            ReportAssembler reportAssembler,
            RevenueSignalPublisher signalPublisher,
            BatchRunner batchRunner,
            TenantDirectory tenants,
            RevenueFeatures features) {
        this.store = store;
        this.aggregator = aggregator;
        this.forecastEngine = forecastEngine;
        this.anomalyDetector = anomalyDetector;
        this.growthAnalyzer = growthAnalyzer;
        this.insightGenerator = insightGenerator;
        this.reportAssembler = reportAssembler;
        this.signalPublisher = signalPublisher;
        this.batchRunner = batchRunner;
        this.tenants = tenants;
        this.features = features;
    }

    // ---- Events ----

    /**
     * @return the ledger sequence assigned to the event
     * @throws RevenueException TENANT_NOT_FOUND, INVALID_EVENT or DUPLICATE_EVENT
     */
    public long recordEvent(RevenueEvent event) {
        if (event == null) {
            throw RevenueException.invalidEvent("event is required");
        }
        requireTenant(event.tenantId());
        return store.append(event);
    }

    public List<RevenueEvent> listEvents(String tenantId, DateRange range) {
        requireValid(range);
        requireTenantOrPlatform(tenantId);
        return store.query(tenantId, range);
    }

    // ---- Metrics ----

    public RevenueMetrics metrics(RevenuePeriod period, String tenantId) {
        requireTenantOrPlatform(tenantId);
        return aggregator.computeMetrics(store.snapshot(), period, tenantId, false);
    }

    public TenantRevenue tenantRevenue(String tenantId, RevenuePeriod period) {
        requireTenant(tenantId);
        String name = tenants.displayName(tenantId).orElse(tenantId);
        return aggregator.computeTenantRevenue(store.snapshot(), period, tenantId, name);
    }

    public RevenueBreakdown breakdown(String tenantId, DateRange range) {
        requireValid(range);
        requireTenantOrPlatform(tenantId);
        return aggregator.computeBreakdown(store.snapshot(), tenantId, range);
    }

    // ---- Intelligence ----

    public List<RevenueForecast> forecast(String tenantId, int monthCount, Set<ForecastScenario> scenarios) {
        requireTenantOrPlatform(tenantId);
        if (!features.forecasting()) {
            return List.of();
        }
        return forecastEngine.forecast(store.snapshot(), tenantId, monthCount, scenarios);
    }

    public List<RevenueAnomaly> detectAnomalies(String tenantId, DateRange range) {
        requireValid(range);
        requireTenantOrPlatform(tenantId);
        if (!features.anomalyDetection()) {
            return List.of();
        }
        return anomalyDetector.detect(store.snapshot(), tenantId, range);
    }

    /** Anomalies over the trailing {@link #DEFAULT_ANOMALY_WINDOW}. */
    public List<RevenueAnomaly> detectAnomalies(String tenantId) {
        requireTenantOrPlatform(tenantId);
        if (!features.anomalyDetection()) {
            return List.of();
        }
        LedgerSnapshot snapshot = store.snapshot();
        return anomalyDetector.detect(snapshot, tenantId, trailingWindow(snapshot));
    }

    public RevenueGrowthAnalysis analyzeGrowth(String tenantId) {
        requireTenantOrPlatform(tenantId);
        return growthAnalyzer.analyze(store.snapshot(), tenantId);
    }

    public PeriodComparison comparePeriods(String tenantId, RevenuePeriod current, RevenuePeriod previous) {
        requireTenantOrPlatform(tenantId);
        return growthAnalyzer.compare(store.snapshot(), tenantId, current, previous);
    }

    public List<RevenueInsight> insights(String tenantId) {
        requireTenantOrPlatform(tenantId);
        if (!features.insightGeneration()) {
            return List.of();
        }
        return insights(store.snapshot(), tenantId);
    }

    // ---- Reports ----

    /**
     * @throws RevenueException UNSUPPORTED_FORMAT before any computation when no encoder handles
     *                          the format, INSUFFICIENT_DATA for an empty period
     */
    public RevenueReport generateReport(String tenantId, RevenuePeriod period, ReportFormat format) {
        requireTenantOrPlatform(tenantId);
        reportAssembler.reportEncoderFor(format);
        return report(store.snapshot(), tenantId, period, format);
    }

    public EncodedDocument exportEvents(String tenantId, DateRange range, ExportFormat format) {
        requireValid(range);
        requireTenantOrPlatform(tenantId);
        reportAssembler.exportEncoderFor(format);
        LedgerSnapshot snapshot = store.snapshot();
        return reportAssembler.export(tenantId, range, format, snapshot.query(tenantId, range), snapshot.asOf());
    }

    // ---- Signals ----

    public Optional<RevenueSignals> currentSignals() {
        return signalPublisher.currentSignals();
    }

    public Subscription subscribe(RevenueSignalListener listener) {
        return signalPublisher.subscribe(listener);
    }

    // ---- Batches ----

    /** Forecasts for several tenants from one snapshot; a failing tenant does not stop the others. */
    public BatchResult<String, List<RevenueForecast>> forecastAll(Collection<String> tenantIds, int monthCount,
                                                                  Set<ForecastScenario> scenarios) {
        LedgerSnapshot snapshot = store.snapshot();
        return batchRunner.run("revenue.forecast", tenantIds, tenantId -> {
            requireTenant(tenantId);
            if (!features.forecasting()) {
                return List.of();
            }
            return forecastEngine.forecast(snapshot, tenantId, monthCount, scenarios);
        });
    }

    public BatchResult<String, List<RevenueAnomaly>> detectAnomaliesAll(Collection<String> tenantIds) {
        LedgerSnapshot snapshot = store.snapshot();
        DateRange window = trailingWindow(snapshot);
        return batchRunner.run("revenue.anomalies", tenantIds, tenantId -> {
            requireTenant(tenantId);
            if (!features.anomalyDetection()) {
                return List.of();
            }
            return anomalyDetector.detect(snapshot, tenantId, window);
        });
    }

    public BatchResult<String, RevenueReport> generateReports(Collection<String> tenantIds, RevenuePeriod period,
                                                              ReportFormat format) {
        reportAssembler.reportEncoderFor(format);
        LedgerSnapshot snapshot = store.snapshot();
        return batchRunner.run("revenue.reports", tenantIds, tenantId -> {
            requireTenant(tenantId);
            return report(snapshot, tenantId, period, format);
        });
    }

    // ---- internals ----

    private RevenueReport report(LedgerSnapshot snapshot, String tenantId, RevenuePeriod period, ReportFormat format) {
        RevenueMetrics metrics = aggregator.computeMetrics(snapshot, period, tenantId, false);
        RevenueMetrics previous = aggregator.computeMetrics(snapshot, period.previous(), tenantId, true);
        RevenueBreakdown breakdown = aggregator.computeBreakdown(snapshot, tenantId, period.toDateRange());
        List<RevenueInsight> insights = features.insightGeneration() ? insights(snapshot, tenantId) : List.of();
        String subject = tenantId == null ? "platform" : tenants.displayName(tenantId).orElse(tenantId);
        String title = "Revenue report " + period.label() + " for " + subject;
        return reportAssembler.assemble(title, format, snapshot.asOf(), metrics,
                previous.eventCount() == 0 ? null : previous, breakdown, insights);
    }

    private List<RevenueInsight> insights(LedgerSnapshot snapshot, String tenantId) {
        RevenuePeriod lastMonth = RevenuePeriod.containing(Granularity.MONTHLY, snapshot.asOf()).previous();
        RevenueMetrics metrics = aggregator.computeMetrics(snapshot, lastMonth, tenantId, true);
        RevenueGrowthAnalysis growth = partial("growth", tenantId,
                () -> growthAnalyzer.analyze(snapshot, tenantId)).orElse(null);
        List<RevenueAnomaly> anomalies = features.anomalyDetection()
                ? partial("anomalies", tenantId,
                        () -> anomalyDetector.detect(snapshot, tenantId, trailingWindow(snapshot))).orElse(List.of())
                : List.of();
        List<RevenueForecast> forecasts = features.forecasting()
                ? partial("forecast", tenantId, () -> forecastEngine.forecast(snapshot, tenantId,
                        INSIGHT_FORECAST_MONTHS, Set.of(ForecastScenario.REALISTIC))).orElse(List.of())
                : List.of();
        return insightGenerator.generate(new InsightContext(tenantId, snapshot.asOf(), snapshot.version(tenantId),
                metrics.eventCount() == 0 ? null : metrics, growth, anomalies, forecasts));
    }

    /**
     * Runs one insight input. Too little history for it is not an error: the rules that need the
     * input stay silent.
     */
    private static <T> Optional<T> partial(String input, String tenantId, Supplier<T> computation) {
        try {
            return Optional.of(computation.get());
        } catch (RevenueException e) {
            if (e.kind() != ErrorKind.COMPUTATION) {
                throw e;
            }
            log.debug("No {} input for insights of {}: {}", input,
                    tenantId == null ? "platform" : tenantId, e.getMessage());
            return Optional.empty();
        }
    }

    private static DateRange trailingWindow(LedgerSnapshot snapshot) {
        Instant end = snapshot.asOf();
        return DateRange.of(end.minus(DEFAULT_ANOMALY_WINDOW), end);
    }

    private static void requireValid(DateRange range) {
        if (range == null) {
            throw RevenueException.invalidRequest("date range is required");
        }
        if (!range.isValid()) {
            throw RevenueException.invalidDateRange(range);
        }
    }

    private void requireTenantOrPlatform(String tenantId) {
        if (tenantId != null) {
            requireTenant(tenantId);
        }
    }

    private void requireTenant(String tenantId) {
        if (tenantId == null || !tenants.exists(tenantId)) {
            throw RevenueException.tenantNotFound(tenantId);
        }
    }
}
