package com.fairway.revenue.signal;

import com.fairway.eventmodel.DateRange;
import com.fairway.eventmodel.RevenueCategory;
import com.fairway.eventmodel.RevenueEvent;
import com.fairway.eventmodel.RevenueEventType;
import com.fairway.revenue.RevenueFeatures;
import com.fairway.revenue.RevenueMath;
import com.fairway.revenue.ledger.LedgerEntry;
import com.fairway.revenue.ledger.LedgerListener;
import com.fairway.revenue.ledger.LedgerSnapshot;
import com.fairway.revenue.ledger.RevenueEventStore;
import com.fairway.revenue.metrics.MetricsAggregator;
import com.fairway.revenue.metrics.PeriodNormalization;
import com.fairway.revenue.period.RevenuePeriod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps platform-wide revenue signals current and pushes them to subscribers after every accepted
 * append.
 *
 * <p>{@link #start()} seeds the running state from a ledger snapshot and remembers, per tenant,
 * how many partition entries the snapshot covered. Appends whose partition index falls below that
 * count are already included and are skipped, so an append racing with the seed is counted exactly
 * once. The state is rebuilt from a fresh snapshot when the calendar month rolls over and when an
 * append lands before the current month and touches a subscription's lifecycle.
 *
 * <p>Every change of the signals bumps a generation counter. Delivery runs under its own lock
 * and always sends the newest generation, skipping any it has already sent, so subscribers never
 * see signals older than ones they already received even when appends race.
 *
 * <p>Running totals sum contributions as recorded and do not convert currencies.
 */
public class RevenueSignalPublisher implements LedgerListener {

    private static final Logger log = LoggerFactory.getLogger(RevenueSignalPublisher.class);

    private final RevenueEventStore store;
    private final RevenueFeatures features;
    private final Clock clock;
    private final List<RevenueSignalListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean();
    private final Object deliveryLock = new Object();

    // guarded by this
    private YearMonth month;
    private Map<String, Integer> seededCounts = Map.of();
    private Set<String> activeAtMonthStart = Set.of();
    private Set<String> cancelledThisMonth = new HashSet<>();
    private BigDecimal net = BigDecimal.ZERO;
    private BigDecimal recurring = BigDecimal.ZERO;
    private long lastSequence;
    private RevenueSignals current;
    private long generation;

    // guarded by deliveryLock
    private long deliveredGeneration;
    private RevenueSignals delivered;

    public RevenueSignalPublisher(RevenueEventStore store, RevenueFeatures features, Clock clock) {
        this.store = store;
        this.features = features;
        this.clock = clock;
    }

    /** Registers with the ledger and seeds the signals. No-op when realtime updates are disabled. */
    public void start() {
        if (!features.realtimeUpdates()) {
            log.info("Realtime revenue signals disabled");
            return;
        }
        if (started.compareAndSet(false, true)) {
            store.addListener(this);
            refresh();
            publishLatest();
        }
    }

    public void stop() {
        if (started.compareAndSet(true, false)) {
            store.removeListener(this);
        }
    }

    /** Rebuilds the running state from a fresh snapshot and returns the resulting signals. */
    public synchronized RevenueSignals refresh() {
        LedgerSnapshot snapshot = store.snapshot();
        month = YearMonth.from(snapshot.asOf().atZone(ZoneOffset.UTC));
        RevenuePeriod period = RevenuePeriod.month(month);

        Map<String, Integer> counts = new HashMap<>();
        for (String tenant : snapshot.tenantIds()) {
            counts.put(tenant, (int) snapshot.version(tenant));
        }
        seededCounts = counts;
        activeAtMonthStart = MetricsAggregator.activeSubscriptionsAt(snapshot, null, period.start());
        cancelledThisMonth = new HashSet<>();
        net = BigDecimal.ZERO;
        recurring = BigDecimal.ZERO;
        lastSequence = 0;
        for (RevenueEvent event : snapshot.query(null, DateRange.of(period.start(), period.end()))) {
            apply(event);
        }
        current = signals(snapshot.asOf());
        generation++;
        log.debug("Seeded revenue signals for {} from {} events", month, snapshot.version(null));
        return current;
    }

    @Override
    public void onAppend(LedgerEntry entry) {
        if (!features.realtimeUpdates()) {
            return;
        }
        if (update(entry)) {
            publishLatest();
        }
    }

    /** Folds the entry into the running state; true when the signals changed. */
    private synchronized boolean update(LedgerEntry entry) {
        Instant now = clock.instant();
        if (month == null || !month.equals(YearMonth.from(now.atZone(ZoneOffset.UTC)))) {
            refresh();
            return true;
        }
        RevenueEvent event = entry.event();
        if (entry.partitionIndex() < seededCounts.getOrDefault(event.tenantId(), 0)) {
            return false;
        }
        YearMonth eventMonth = YearMonth.from(event.timestamp().atZone(ZoneOffset.UTC));
        if (eventMonth.isBefore(month) && event.subscriptionId() != null && event.type().isSubscriptionLifecycle()) {
            refresh();
            return true;
        }
        if (!eventMonth.equals(month)) {
            return false;
        }
        apply(event);
        lastSequence = Math.max(lastSequence, entry.sequence());
        current = signals(now);
        generation++;
        return true;
    }

    private void apply(RevenueEvent event) {
        BigDecimal contribution = event.contribution();
        RevenueCategory category = event.type().category();
        switch (category) {
            case RECURRING -> {
                recurring = recurring.add(contribution);
                net = net.add(contribution);
            }
            case USAGE, ONE_TIME, REFUND -> net = net.add(contribution);
            case LIFECYCLE -> {
                String key = MetricsAggregator.subscriptionKey(event);
                if (event.type() == RevenueEventType.SUBSCRIPTION_CANCELLED && activeAtMonthStart.contains(key)) {
                    cancelledThisMonth.add(key);
                }
            }
            default -> throw new IllegalStateException("Unhandled category " + category);
        }
    }

    private RevenueSignals signals(Instant updatedAt) {
        RevenuePeriod period = RevenuePeriod.month(month);
        BigDecimal churn = RevenueMath.ratio(BigDecimal.valueOf(cancelledThisMonth.size()),
                BigDecimal.valueOf(activeAtMonthStart.size()));
        return new RevenueSignals(
                RevenueMath.money(net),
                PeriodNormalization.monthlyRecurring(recurring, period),
                PeriodNormalization.annualRecurring(recurring, period),
                churn,
                month,
                lastSequence,
                updatedAt);
    }

    /**
     * Registers a subscriber. When signals are already available the subscriber receives the last
     * published ones immediately.
     */
    public Subscription subscribe(RevenueSignalListener listener) {
        synchronized (deliveryLock) {
            publishLatest();
            listeners.add(listener);
            if (delivered != null) {
                deliver(listener, delivered);
            }
        }
        return new Subscription() {
            private final AtomicBoolean active = new AtomicBoolean(true);

            @Override
            public void cancel() {
                if (active.compareAndSet(true, false)) {
                    listeners.remove(listener);
                }
            }

            @Override
            public boolean isActive() {
                return active.get();
            }
        };
    }

    public synchronized Optional<RevenueSignals> currentSignals() {
        return Optional.ofNullable(current);
    }

    public int subscriberCount() {
        return listeners.size();
    }

    /** Sends the newest signals to every subscriber unless that generation was already sent. */
    private void publishLatest() {
        synchronized (deliveryLock) {
            RevenueSignals signals;
            long latest;
            synchronized (this) {
                signals = current;
                latest = generation;
            }
            if (signals == null || latest <= deliveredGeneration) {
                return;
            }
            deliveredGeneration = latest;
            delivered = signals;
            for (RevenueSignalListener listener : listeners) {
                deliver(listener, signals);
            }
        }
    }

    private static void deliver(RevenueSignalListener listener, RevenueSignals signals) {
        try {
            listener.onSignals(signals);
        } catch (RuntimeException e) {
            log.warn("Revenue signal subscriber {} failed", listener, e);
        }
    }
}
