package com.fairway.revenueservice.api;

import com.fairway.eventmodel.DateRange;
import com.fairway.eventmodel.RevenueEvent;
import com.fairway.revenue.RevenueAnalyticsService;
import com.fairway.revenue.RevenueException;
import com.fairway.revenue.anomaly.RevenueAnomaly;
import com.fairway.revenue.forecast.ForecastScenario;
import com.fairway.revenue.forecast.RevenueForecast;
import com.fairway.revenue.growth.PeriodComparison;
import com.fairway.revenue.growth.RevenueGrowthAnalysis;
import com.fairway.revenue.insight.RevenueInsight;
import com.fairway.revenue.metrics.RevenueBreakdown;
import com.fairway.revenue.metrics.RevenueMetrics;
import com.fairway.revenue.metrics.TenantRevenue;
import com.fairway.revenue.period.Granularity;
import com.fairway.revenue.period.RevenuePeriod;
import com.fairway.revenue.report.EncodedDocument;
import com.fairway.revenue.report.ExportFormat;
import com.fairway.revenue.report.ReportFormat;
import com.fairway.revenue.report.RevenueReport;
import com.fairway.revenue.signal.RevenueSignals;
import com.fairway.revenue.signal.Subscription;
import com.fairway.revenueservice.api.dto.BatchRequest;
import com.fairway.revenueservice.api.dto.BatchResponse;
import com.fairway.revenueservice.api.dto.RecordEventRequest;
import com.fairway.revenueservice.api.dto.RecordEventResponse;
import com.fairway.security.FairwaySecurityContext;
import com.fairway.security.Role;
import com.fairway.tenant.TenantRepository;
import jakarta.validation.Valid;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST surface of the revenue analytics core.
 *
 * <p>Endpoints taking an optional {@code tenantId} answer for the whole platform when it is left
 * out. Periods are given as a granularity plus an instant inside the bucket ({@code at}, default
 * now), or as an explicit {@code from}/{@code to} window.
 */
@RestController
@RequestMapping("/api/v1/revenue")
public class RevenueController {

    private static final Logger log = LoggerFactory.getLogger(RevenueController.class);

    static final Duration SIGNAL_STREAM_TIMEOUT = Duration.ofMinutes(30);
    static final Duration DEFAULT_LIST_WINDOW = Duration.ofDays(30);

    private final RevenueAnalyticsService revenue;
    private final AccessGuard guard;
    private final Clock clock;

    public RevenueController(RevenueAnalyticsService revenue, TenantRepository tenants, Clock clock) {
        this.revenue = revenue;
        this.guard = new AccessGuard(tenants);
        this.clock = clock;
    }

    // ---- Events ----

    @PostMapping("/tenants/{tenantId}/events")
    @ResponseStatus(HttpStatus.CREATED)
    public RecordEventResponse recordEvent(@PathVariable String tenantId,
                                           @Valid @RequestBody RecordEventRequest request,
                                           FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.BILLING_ADMIN);
        RevenueEvent event = request.toEvent(tenantId, clock.instant());
        long sequence = revenue.recordEvent(event);
        return new RecordEventResponse(event.id(), sequence);
    }

    @GetMapping("/events")
    public List<RevenueEvent> listEvents(@RequestParam(required = false) String tenantId,
                                         @RequestParam(required = false) Instant from,
                                         @RequestParam(required = false) Instant to,
                                         FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.ANALYST);
        return revenue.listEvents(tenantId, range(from, to));
    }

    // ---- Metrics ----

    @GetMapping("/metrics")
    public RevenueMetrics metrics(@RequestParam(required = false) String tenantId,
                                  @RequestParam(defaultValue = "monthly") String granularity,
                                  @RequestParam(required = false) Instant at,
                                  @RequestParam(required = false) Instant from,
                                  @RequestParam(required = false) Instant to,
                                  FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.ANALYST);
        return revenue.metrics(period(granularity, at, from, to), tenantId);
    }

    @GetMapping("/tenants/{tenantId}/revenue")
    public TenantRevenue tenantRevenue(@PathVariable String tenantId,
                                       @RequestParam(defaultValue = "monthly") String granularity,
                                       @RequestParam(required = false) Instant at,
                                       @RequestParam(required = false) Instant from,
                                       @RequestParam(required = false) Instant to,
                                       FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.ANALYST);
        return revenue.tenantRevenue(tenantId, period(granularity, at, from, to));
    }

    @GetMapping("/breakdown")
    public RevenueBreakdown breakdown(@RequestParam(required = false) String tenantId,
                                      @RequestParam(required = false) Instant from,
                                      @RequestParam(required = false) Instant to,
                                      FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.ANALYST);
        return revenue.breakdown(tenantId, range(from, to));
    }

    // ---- Intelligence ----

    @GetMapping("/forecast")
    public List<RevenueForecast> forecast(@RequestParam(required = false) String tenantId,
                                          @RequestParam(defaultValue = "3") int months,
                                          @RequestParam(required = false) List<String> scenarios,
                                          FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.ANALYST);
        return revenue.forecast(tenantId, months, scenarios(scenarios));
    }

    @GetMapping("/anomalies")
    public List<RevenueAnomaly> anomalies(@RequestParam(required = false) String tenantId,
                                          @RequestParam(required = false) Instant from,
                                          @RequestParam(required = false) Instant to,
                                          FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.ANALYST);
        if (from == null && to == null) {
            return revenue.detectAnomalies(tenantId);
        }
        return revenue.detectAnomalies(tenantId, range(from, to));
    }

    @GetMapping("/growth")
    public RevenueGrowthAnalysis growth(@RequestParam(required = false) String tenantId,
                                        FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.ANALYST);
        return revenue.analyzeGrowth(tenantId);
    }

    /** Compares the bucket containing {@code current} with the one containing {@code previous}. */
    @GetMapping("/compare")
    public PeriodComparison compare(@RequestParam(required = false) String tenantId,
                                    @RequestParam(defaultValue = "monthly") String granularity,
                                    @RequestParam(required = false) Instant current,
                                    @RequestParam(required = false) Instant previous,
                                    FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.ANALYST);
        RevenuePeriod currentPeriod = period(granularity, current, null, null);
        RevenuePeriod previousPeriod = previous == null
                ? currentPeriod.previous()
                : period(granularity, previous, null, null);
        return revenue.comparePeriods(tenantId, currentPeriod, previousPeriod);
    }

    @GetMapping("/insights")
    public List<RevenueInsight> insights(@RequestParam(required = false) String tenantId,
                                         FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.ANALYST);
        return revenue.insights(tenantId);
    }

    // ---- Reports ----

    @GetMapping("/report")
    public ResponseEntity<byte[]> report(@RequestParam(required = false) String tenantId,
                                         @RequestParam(defaultValue = "monthly") String granularity,
                                         @RequestParam(required = false) Instant at,
                                         @RequestParam(required = false) Instant from,
                                         @RequestParam(required = false) Instant to,
                                         @RequestParam(defaultValue = "json") String format,
                                         FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.ANALYST);
        ReportFormat reportFormat = ReportFormat.fromString(format)
                .orElseThrow(() -> RevenueException.unsupportedFormat(format));
        RevenueReport report = revenue.generateReport(tenantId, period(granularity, at, from, to), reportFormat);
        return download(report.document());
    }

    @GetMapping("/export")
    public ResponseEntity<byte[]> export(@RequestParam(required = false) String tenantId,
                                         @RequestParam(required = false) Instant from,
                                         @RequestParam(required = false) Instant to,
                                         @RequestParam(defaultValue = "json") String format,
                                         FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.ANALYST);
        ExportFormat exportFormat = ExportFormat.fromString(format)
                .orElseThrow(() -> RevenueException.unsupportedFormat(format));
        return download(revenue.exportEvents(tenantId, range(from, to), exportFormat));
    }

    // ---- Signals ----

    @GetMapping("/signals")
    public ResponseEntity<RevenueSignals> signals(FairwaySecurityContext context) {
        guard.requirePlatformAdmin(context);
        return revenue.currentSignals()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * Server-sent stream of platform signals. The latest signals are sent on connect, then every
     * update until the client disconnects or the stream times out.
     */
    @GetMapping(path = "/signals/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamSignals(FairwaySecurityContext context) {
        guard.requirePlatformAdmin(context);
        SseEmitter emitter = new SseEmitter(SIGNAL_STREAM_TIMEOUT.toMillis());
        AtomicReference<Subscription> subscription = new AtomicReference<>();

        subscription.set(revenue.subscribe(signals -> send(emitter, signals, subscription.get())));
        emitter.onCompletion(() -> cancel(subscription.get()));
        emitter.onTimeout(() -> cancel(subscription.get()));
        emitter.onError(error -> cancel(subscription.get()));
        return emitter;
    }

    // ---- Batches ----

    @PostMapping("/batch/forecasts")
    public BatchResponse<List<RevenueForecast>> forecastAll(@Valid @RequestBody BatchRequest request,
                                                            @RequestParam(defaultValue = "3") int months,
                                                            @RequestParam(required = false) List<String> scenarios,
                                                            FairwaySecurityContext context) {
        guard.requirePlatformAdmin(context);
        return BatchResponse.from(
                revenue.forecastAll(request.distinctTenantIds(), months, scenarios(scenarios)));
    }

    @PostMapping("/batch/anomalies")
    public BatchResponse<List<RevenueAnomaly>> detectAnomaliesAll(@Valid @RequestBody BatchRequest request,
                                                                  FairwaySecurityContext context) {
        guard.requirePlatformAdmin(context);
        return BatchResponse.from(revenue.detectAnomaliesAll(request.distinctTenantIds()));
    }

    @PostMapping("/batch/reports")
    public BatchResponse<RevenueReport> generateReports(@Valid @RequestBody BatchRequest request,
                                                        @RequestParam(defaultValue = "monthly") String granularity,
                                                        @RequestParam(required = false) Instant at,
                                                        @RequestParam(defaultValue = "json") String format,
                                                        FairwaySecurityContext context) {
        guard.requirePlatformAdmin(context);
        ReportFormat reportFormat = ReportFormat.fromString(format)
                .orElseThrow(() -> RevenueException.unsupportedFormat(format));
        return BatchResponse.from(revenue.generateReports(
                request.distinctTenantIds(), period(granularity, at, null, null), reportFormat));
    }

    // ---- helpers ----

    private RevenuePeriod period(String granularity, Instant at, Instant from, Instant to) {
        if (from != null || to != null) {
            if (from == null || to == null) {
                throw RevenueException.invalidPeriod("a custom period needs both from and to");
            }
            return RevenuePeriod.custom(from, to);
        }
        Granularity bucket = Granularity.fromString(granularity)
                .orElseThrow(() -> RevenueException.invalidPeriod("unknown granularity: " + granularity));
        return RevenuePeriod.containing(bucket, at == null ? clock.instant() : at);
    }

    /** Defaults to the trailing window ending now. */
    private DateRange range(Instant from, Instant to) {
        Instant end = to == null ? clock.instant() : to;
        Instant start = from == null ? end.minus(DEFAULT_LIST_WINDOW) : from;
        return DateRange.of(start, end);
    }

    private static Set<ForecastScenario> scenarios(List<String> names) {
        if (names == null || names.isEmpty()) {
            return EnumSet.allOf(ForecastScenario.class);
        }
        EnumSet<ForecastScenario> parsed = EnumSet.noneOf(ForecastScenario.class);
        for (String name : names) {
            parsed.add(ForecastScenario.fromString(name)
                    .orElseThrow(() -> RevenueException.invalidRequest("unknown scenario: " + name)));
        }
        return parsed;
    }

    private static ResponseEntity<byte[]> download(EncodedDocument document) {
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(document.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(document.fileName()).build().toString())
                .body(document.content());
    }

    private static void send(SseEmitter emitter, RevenueSignals signals, Subscription subscription) {
        try {
            emitter.send(SseEmitter.event().name("signals").data(signals, MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            log.debug("Signal stream closed: {}", e.getMessage());
            cancel(subscription);
            emitter.completeWithError(e);
        }
    }

    private static void cancel(Subscription subscription) {
        if (subscription != null) {
            subscription.cancel();
        }
    }
}
