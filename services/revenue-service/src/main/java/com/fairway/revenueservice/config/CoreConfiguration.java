package com.fairway.revenueservice.config;

import com.fairway.common.BoundedCall;
import com.fairway.common.batch.BatchRunner;
import com.fairway.observability.MetricFactory;
import com.fairway.observability.SensitiveDataRedactor;
import com.fairway.observability.SpanHelper;
import com.fairway.revenue.RevenueAnalyticsService;
import com.fairway.revenue.RevenueFeatures;
import com.fairway.revenue.TenantDirectory;
import com.fairway.revenue.anomaly.AnomalyDetector;
import com.fairway.revenue.forecast.ForecastEngine;
import com.fairway.revenue.growth.GrowthAnalyzer;
import com.fairway.revenue.insight.InsightGenerator;
import com.fairway.revenue.ledger.AuditLogger;
import com.fairway.revenue.ledger.InMemoryRevenueEventStore;
import com.fairway.revenue.metrics.MetricsAggregator;
import com.fairway.revenue.metrics.MetricsSnapshotCache;
import com.fairway.revenue.report.ExportEncoder;
import com.fairway.revenue.report.ReportAssembler;
import com.fairway.revenue.report.ReportEncoder;
import com.fairway.revenue.signal.RevenueSignalPublisher;
import com.fairway.revenueservice.infrastructure.encoding.JsonExportEncoder;
import com.fairway.revenueservice.infrastructure.encoding.JsonReportEncoder;
import com.fairway.revenueservice.infrastructure.tenant.ConfiguredSloFeed;
import com.fairway.revenueservice.infrastructure.tenant.GovernedTenantDirectory;
import com.fairway.revenueservice.infrastructure.tenant.LoggingTenantDataMigrator;
import com.fairway.revenueservice.infrastructure.tenant.MeteredTenantListener;
import com.fairway.tenant.InMemoryTenantRepository;
import com.fairway.tenant.TenantGovernanceService;
import com.fairway.tenant.TenantRepository;
import com.fairway.tenant.health.SloFeed;
import com.fairway.tenant.health.TenantHealthScorer;
import com.fairway.tenant.limits.InMemoryUsageCounterStore;
import com.fairway.tenant.limits.TenantLimitGovernor;
import com.fairway.tenant.limits.UsageCounterStore;
import com.fairway.tenant.migration.TenantDataMigrator;
import com.fairway.tenant.migration.TenantMigrationCoordinator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free analytics and governance libraries into the Spring context.
 */
@Configuration
public class CoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CoreConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RevenueFeatures revenueFeatures(RevenueProperties properties) {
        RevenueFeatures features = properties.features().toRevenueFeatures();
        log.info("Revenue features: {}", features);
        return features;
    }

    // ---- Observability ----

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    @ConditionalOnMissingBean
    public OpenTelemetry openTelemetry() {
        return GlobalOpenTelemetry.get();
    }

    @Bean
    public SpanHelper spanHelper(OpenTelemetry openTelemetry, ServiceProperties service) {
        return new SpanHelper(openTelemetry.getTracer(service.name()));
    }

    @Bean
    public BoundedCall boundedCall(RevenueProperties properties) {
        return new BoundedCall(properties.collaboratorTimeout());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService batchExecutor(RevenueProperties properties) {
        return Executors.newFixedThreadPool(properties.batchParallelism());
    }

    @Bean
    public BatchRunner batchRunner(ExecutorService batchExecutor, SpanHelper spanHelper) {
        return new BatchRunner(batchExecutor, spanHelper);
    }

    // ---- Revenue analytics ----

    @Bean
    public InMemoryRevenueEventStore revenueEventStore(Clock clock, MetricFactory metrics, RevenueFeatures features) {
        InMemoryRevenueEventStore store = new InMemoryRevenueEventStore(clock, metrics);
        if (features.auditLogging()) {
            store.addListener(new AuditLogger(new SensitiveDataRedactor(), features.encryption()));
        }
        return store;
    }

    @Bean
    public MetricsAggregator metricsAggregator(InMemoryRevenueEventStore store, RevenueFeatures features,
                                               MetricFactory metrics) {
        return new MetricsAggregator(store, new MetricsSnapshotCache(), features, metrics);
    }

    @Bean
    public JsonReportEncoder jsonReportEncoder(ObjectMapper objectMapper) {
        return new JsonReportEncoder(objectMapper);
    }

    @Bean
    public JsonExportEncoder jsonExportEncoder(ObjectMapper objectMapper) {
        return new JsonExportEncoder(objectMapper);
    }

    @Bean
    public ReportAssembler reportAssembler(List<ReportEncoder> reportEncoders, List<ExportEncoder> exportEncoders,
                                           BoundedCall boundedCall) {
        return new ReportAssembler(reportEncoders, exportEncoders, boundedCall);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public RevenueSignalPublisher revenueSignalPublisher(InMemoryRevenueEventStore store, RevenueFeatures features,
                                                         Clock clock) {
        return new RevenueSignalPublisher(store, features, clock);
    }

    @Bean
    public TenantDirectory tenantDirectory(TenantRepository tenantRepository) {
        return new GovernedTenantDirectory(tenantRepository);
    }

    @Bean
    public RevenueAnalyticsService revenueAnalyticsService(
            InMemoryRevenueEventStore store,
            MetricsAggregator aggregator,
            ReportAssembler reportAssembler,
            RevenueSignalPublisher signalPublisher,
            BatchRunner batchRunner,
            TenantDirectory tenantDirectory,
            RevenueFeatures features) {
        return new RevenueAnalyticsService(
                store,
                aggregator,
                new ForecastEngine(aggregator),
                new AnomalyDetector(aggregator),
                new GrowthAnalyzer(aggregator, features),
                new InsightGenerator(),
                reportAssembler,
                signalPublisher,
                batchRunner,
                tenantDirectory,
                features);
    }

    // ---- Tenant governance ----

    @Bean
    public TenantRepository tenantRepository() {
        return new InMemoryTenantRepository();
    }

    @Bean
    public UsageCounterStore usageCounterStore(Clock clock) {
        return new InMemoryUsageCounterStore(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SloFeed sloFeed(RevenueProperties properties, Clock clock) {
        return new ConfiguredSloFeed(properties.slo(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public TenantDataMigrator tenantDataMigrator() {
        return new LoggingTenantDataMigrator();
    }

    @Bean
    public TenantGovernanceService tenantGovernanceService(
            TenantRepository tenantRepository,
            UsageCounterStore usageCounterStore,
            SloFeed sloFeed,
            TenantDataMigrator tenantDataMigrator,
            BoundedCall boundedCall,
            BatchRunner batchRunner,
            MetricFactory metrics,
            Clock clock) {
        TenantLimitGovernor governor = new TenantLimitGovernor(tenantRepository, usageCounterStore);
        TenantGovernanceService governance = new TenantGovernanceService(
                tenantRepository,
                governor,
                new TenantHealthScorer(governor, sloFeed, boundedCall, metrics, clock),
                new TenantMigrationCoordinator(tenantDataMigrator, boundedCall, clock),
                batchRunner,
                clock);
        governance.addListener(new MeteredTenantListener(metrics));
        return governance;
    }
}
