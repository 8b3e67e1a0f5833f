package com.fairway.revenue.metrics;

import com.fairway.eventmodel.DateRange;
import com.fairway.eventmodel.RevenueEvent;
import com.fairway.eventmodel.RevenueEventType;
import com.fairway.observability.MetricFactory;
import com.fairway.revenue.RevenueException;
import com.fairway.revenue.RevenueFeatures;
import com.fairway.revenue.RevenueMath;
import com.fairway.revenue.ledger.LedgerSnapshot;
import com.fairway.revenue.ledger.RevenueEventStore;
import com.fairway.revenue.period.RevenuePeriod;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Derives {@link RevenueMetrics}, {@link RevenueBreakdown} and bucketed series from ledger
 * snapshots.
 *
 * <p>Every computation is a pure function of the snapshot's visible events: it never writes to the
 * ledger, and the same events give an equal result regardless of their order.
 */
public class MetricsAggregator {

    private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);

    private final RevenueEventStore store;
    private final MetricsSnapshotCache cache;
    private final RevenueFeatures features;
    private final Timer computeTimer;

    public MetricsAggregator(RevenueEventStore store, MetricsSnapshotCache cache,
                             RevenueFeatures features, MetricFactory metrics) {
        this.store = store;
        this.cache = cache;
        this.features = features;
        this.computeTimer = metrics.timer("revenue.metrics.compute", "Time spent computing revenue metrics");
    }

    /**
     * Metrics over a fresh snapshot.
     *
     * @throws RevenueException INSUFFICIENT_DATA when the window holds no events
     */
    public RevenueMetrics computeMetrics(RevenuePeriod period, String tenantId) {
        return computeMetrics(store.snapshot(), period, tenantId, false);
    }

    /**
     * @param snapshot           ledger view to read
     * @param period             bucket to measure
     * @param tenantId           tenant, or null for platform-wide
     * @param allowEmptyBaseline return zero-valued metrics for an empty window instead of failing
     * @throws RevenueException INSUFFICIENT_DATA for an empty window unless allowed, CALCULATION_ERROR
     *                          for mixed currencies
     */
    public RevenueMetrics computeMetrics(LedgerSnapshot snapshot, RevenuePeriod period, String tenantId,
                                         boolean allowEmptyBaseline) {
        long version = snapshot.version(tenantId);
        String ledgerId = features.caching() ? snapshot.ledgerId().orElse(null) : null;
        if (ledgerId != null) {
            var cached = cache.get(ledgerId, tenantId, period, version);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        RevenueMetrics metrics = computeTimer.record(() -> compute(snapshot, period, tenantId, version));
        if (metrics.eventCount() == 0) {
            if (!allowEmptyBaseline) {
                throw RevenueException.insufficientData(
                        "no revenue events for " + describe(tenantId) + " in " + period.label());
            }
            return metrics;
        }
        if (ledgerId != null) {
            cache.put(ledgerId, metrics);
        }
        return metrics;
    }

    private RevenueMetrics compute(LedgerSnapshot snapshot, RevenuePeriod period, String tenantId, long version) {
        List<RevenueEvent> events = snapshot.query(tenantId, period.toDateRange());
        RevenueTotals totals = RevenueTotals.of(events);

        RevenuePeriod previous = period.previous();
        RevenueTotals previousTotals = RevenueTotals.of(snapshot.query(tenantId, previous.toDateRange()));
        String currency = RevenueTotals.requireSameCurrency(totals.currency(), previousTotals.currency());

        long customers = countCustomers(events);
        BigDecimal net = totals.net();
        BigDecimal arpc = customers == 0
                ? RevenueMath.money(BigDecimal.ZERO)
                : net.divide(BigDecimal.valueOf(customers), RevenueMath.MONEY_SCALE, RevenueMath.ROUNDING);
        BigDecimal churn = churnRate(snapshot, tenantId, period, events);
        BigDecimal lifetimeValue = churn.signum() > 0
                ? arpc.divide(churn, RevenueMath.MONEY_SCALE, RevenueMath.ROUNDING)
                : RevenueMath.money(arpc.multiply(TWELVE));

        BigDecimal previousNet = previousTotals.net();
        boolean growthDefined = previousNet.signum() != 0;
        BigDecimal growth = growthDefined
                ? RevenueMath.ratio(net.subtract(previousNet), previousNet.abs())
                : RevenueMath.rate(BigDecimal.ZERO);

        log.debug("Computed metrics for {} {}: {} events, net {}",
                describe(tenantId), period.label(), totals.eventCount(), net);

        return new RevenueMetrics(
                tenantId,
                period,
                currency,
                RevenueMath.money(totals.gross()),
                RevenueMath.money(totals.recurring()),
                RevenueMath.money(totals.usage()),
                RevenueMath.money(totals.oneTime()),
                RevenueMath.money(totals.refunds()),
                RevenueMath.money(net),
                customers,
                arpc,
                lifetimeValue,
                churn,
                growth,
                growthDefined,
                PeriodNormalization.monthlyRecurring(totals.recurring(), period),
                PeriodNormalization.annualRecurring(totals.recurring(), period),
                totals.eventCount(),
                version);
    }

    /**
     * Breakdown of the window by product line, tier, region and channel.
     *
     * @throws RevenueException INVALID_DATE_RANGE for an inverted range
     */
    public RevenueBreakdown computeBreakdown(LedgerSnapshot snapshot, String tenantId, DateRange range) {
        List<RevenueEvent> events = snapshot.query(tenantId, range);
        RevenueTotals totals = RevenueTotals.of(events);

        Map<String, BigDecimal> byTier = new TreeMap<>();
        Map<String, BigDecimal> byRegion = new TreeMap<>();
        Map<String, BigDecimal> byChannel = new TreeMap<>();
        for (RevenueEvent event : events) {
            BigDecimal contribution = event.contribution();
            byTier.merge(attributeOrUnassigned(event, "tier"), contribution, BigDecimal::add);
            byRegion.merge(attributeOrUnassigned(event, "region"), contribution, BigDecimal::add);
            byChannel.merge(event.source().value(), contribution, BigDecimal::add);
        }
        byTier.replaceAll((k, v) -> RevenueMath.money(v));
        byRegion.replaceAll((k, v) -> RevenueMath.money(v));
        byChannel.replaceAll((k, v) -> RevenueMath.money(v));

        return new RevenueBreakdown(
                tenantId,
                range,
                totals.currency(),
                RevenueMath.money(totals.recurring()),
                RevenueMath.money(totals.usage()),
                RevenueMath.money(totals.forType(RevenueEventType.ONE_TIME_PAYMENT)),
                RevenueMath.money(totals.forType(RevenueEventType.SETUP_FEE)),
                RevenueMath.money(totals.forType(RevenueEventType.ADD_ON_PURCHASE)),
                RevenueMath.money(totals.refunds()),
                new TreeMap<>(byTier),
                new TreeMap<>(byRegion),
                new TreeMap<>(byChannel));
    }

    public TenantRevenue computeTenantRevenue(LedgerSnapshot snapshot, RevenuePeriod period,
                                              String tenantId, String tenantName) {
        return TenantRevenue.from(computeMetrics(snapshot, period, tenantId, true), tenantName);
    }

    /**
     * Totals per calendar month, oldest first, for every month in {@code [from, to]}. Months
     * without events yield empty totals.
     */
    public List<PeriodTotals> monthlySeries(LedgerSnapshot snapshot, String tenantId, YearMonth from, YearMonth to) {
        if (from.isAfter(to)) {
            throw RevenueException.invalidPeriod("series start " + from + " is after end " + to);
        }
        Instant start = RevenuePeriod.month(from).start();
        Instant end = RevenuePeriod.month(to).end();
        Map<YearMonth, List<RevenueEvent>> grouped = new HashMap<>();
        for (RevenueEvent event : snapshot.query(tenantId, DateRange.of(start, end))) {
            grouped.computeIfAbsent(YearMonth.from(event.timestamp().atZone(ZoneOffset.UTC)),
                    k -> new ArrayList<>()).add(event);
        }
        List<PeriodTotals> series = new ArrayList<>();
        for (YearMonth month = from; !month.isAfter(to); month = month.plusMonths(1)) {
            series.add(new PeriodTotals(RevenuePeriod.month(month),
                    RevenueTotals.of(grouped.getOrDefault(month, List.of()))));
        }
        return series;
    }

    /**
     * Totals per UTC day, oldest first, for every day in {@code [from, to]}.
     */
    public List<PeriodTotals> dailySeries(LedgerSnapshot snapshot, String tenantId, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw RevenueException.invalidPeriod("series start " + from + " is after end " + to);
        }
        Instant start = RevenuePeriod.day(from).start();
        Instant end = RevenuePeriod.day(to).end();
        Map<LocalDate, List<RevenueEvent>> grouped = new HashMap<>();
        for (RevenueEvent event : snapshot.query(tenantId, DateRange.of(start, end))) {
            grouped.computeIfAbsent(LocalDate.ofInstant(event.timestamp(), ZoneOffset.UTC),
                    k -> new ArrayList<>()).add(event);
        }
        List<PeriodTotals> series = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            series.add(new PeriodTotals(RevenuePeriod.day(day),
                    RevenueTotals.of(grouped.getOrDefault(day, List.of()))));
        }
        return series;
    }

    private static long countCustomers(List<RevenueEvent> events) {
        Set<String> customers = new HashSet<>();
        for (RevenueEvent event : events) {
            if (event.customerId() != null && event.type() != RevenueEventType.SUBSCRIPTION_CANCELLED) {
                customers.add(event.customerId());
            }
        }
        return customers.size();
    }

    /**
     * Cancelled subscriptions in the window among those active at its start, divided by the number
     * active at its start. A subscription is active when its last lifecycle event before the start
     * is not a cancellation.
     */
    private static BigDecimal churnRate(LedgerSnapshot snapshot, String tenantId, RevenuePeriod period,
                                        List<RevenueEvent> windowEvents) {
        Set<String> active = activeSubscriptionsAt(snapshot, tenantId, period.start());
        if (active.isEmpty()) {
            return RevenueMath.rate(BigDecimal.ZERO);
        }
        Set<String> cancelled = new HashSet<>();
        for (RevenueEvent event : windowEvents) {
            if (event.type() == RevenueEventType.SUBSCRIPTION_CANCELLED
                    && active.contains(subscriptionKey(event))) {
                cancelled.add(subscriptionKey(event));
            }
        }
        return RevenueMath.ratio(BigDecimal.valueOf(cancelled.size()), BigDecimal.valueOf(active.size()));
    }

    /**
     * Subscriptions (keyed by tenant and subscription id) whose latest lifecycle event before
     * {@code instant} is not a cancellation.
     */
    public static Set<String> activeSubscriptionsAt(LedgerSnapshot snapshot, String tenantId, Instant instant) {
        Map<String, RevenueEventType> lastLifecycle = new HashMap<>();
        for (RevenueEvent event : snapshot.query(tenantId, DateRange.of(Instant.EPOCH, instant))) {
            if (event.subscriptionId() != null && event.type().isSubscriptionLifecycle()) {
                // canonical order, so the last write wins
                lastLifecycle.put(subscriptionKey(event), event.type());
            }
        }
        Set<String> active = new HashSet<>();
        lastLifecycle.forEach((subscription, type) -> {
            if (type != RevenueEventType.SUBSCRIPTION_CANCELLED) {
                active.add(subscription);
            }
        });
        return active;
    }

    /** Subscription ids are only unique within a tenant. */
    public static String subscriptionKey(RevenueEvent event) {
        return event.tenantId() + "/" + event.subscriptionId();
    }

    private static String attributeOrUnassigned(RevenueEvent event, String key) {
        String value = event.attribute(key);
        return value == null || value.isBlank() ? RevenueBreakdown.UNASSIGNED : value;
    }

    private static String describe(String tenantId) {
        return tenantId == null ? "platform" : "tenant " + tenantId;
    }
}
