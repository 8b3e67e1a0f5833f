package com.fairway.revenue.ledger;

import com.fairway.eventmodel.DateRange;
import com.fairway.eventmodel.RevenueEvent;
import com.fairway.eventmodel.RevenueEventValidator;
import com.fairway.eventmodel.ValidationResult;
import com.fairway.observability.MetricFactory;
import com.fairway.revenue.RevenueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory {@link RevenueEventStore}.
 *
 * <p>Events are validated first, without locking. Each tenant partition has its own lock; the
 * duplicate check, sequence assignment and the append happen under it, so appends for one tenant are totally ordered while appends
 * for different tenants run in parallel. Partitions are copy-on-write lists that only grow, which
 * lets {@link #snapshot()} record a committed count per partition without locking.
 */
public class InMemoryRevenueEventStore implements RevenueEventStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRevenueEventStore.class);

    private final String ledgerId = UUID.randomUUID().toString();
    private final Map<String, Partition> partitions = new ConcurrentHashMap<>();
    private final Map<UUID, String> knownIds = new ConcurrentHashMap<>();
    private final List<LedgerListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final RevenueEventValidator validator;
    private final Clock clock;
    private final MetricFactory metrics;

    public InMemoryRevenueEventStore(Clock clock, MetricFactory metrics) {
        this(clock, new RevenueEventValidator(clock), metrics);
    }

    public InMemoryRevenueEventStore(Clock clock, RevenueEventValidator validator, MetricFactory metrics) {
        this.clock = clock;
        this.validator = validator;
        this.metrics = metrics;
    }

    @Override
    public long append(RevenueEvent event) {
        ValidationResult result = validator.validate(event);
        if (!result.valid()) {
            reject(event == null ? null : event.tenantId(), RevenueException.INVALID_EVENT);
            throw RevenueException.invalidEvent(result.summary());
        }

        Partition partition = partitions.computeIfAbsent(event.tenantId(), k -> new Partition());
        LedgerEntry entry;
        partition.lock.lock();
        try {
            if (knownIds.putIfAbsent(event.id(), event.tenantId()) != null) {
                reject(event.tenantId(), RevenueException.DUPLICATE_EVENT);
                throw RevenueException.duplicateEvent(event.id());
            }
            long seq = sequence.incrementAndGet();
            int index = partition.events.size();
            partition.events.add(event);
            partition.committed = index + 1;
            entry = new LedgerEntry(seq, index, event);
        } finally {
            partition.lock.unlock();
        }

        metrics.tenantCounter("revenue.events.appended", "Revenue events accepted into the ledger",
                event.tenantId(), "type", event.type().value()).increment();
        log.debug("Appended revenue event {} for tenant {} at sequence {}",
                event.id(), event.tenantId(), entry.sequence());
        notifyListeners(entry);
        return entry.sequence();
    }

    @Override
    public List<RevenueEvent> query(String tenantId, DateRange range) {
        if (!range.isValid()) {
            throw RevenueException.invalidDateRange(range);
        }
        return snapshot().query(tenantId, range);
    }

    @Override
    public LedgerSnapshot snapshot() {
        Map<String, List<RevenueEvent>> views = new HashMap<>();
        Map<String, Integer> counts = new HashMap<>();
        partitions.forEach((tenant, partition) -> {
            int committed = partition.committed;
            if (committed > 0) {
                views.put(tenant, partition.events);
                counts.put(tenant, committed);
            }
        });
        return new LedgerSnapshot(ledgerId, clock.instant(), views, counts);
    }

    @Override
    public void addListener(LedgerListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(LedgerListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(LedgerEntry entry) {
        for (LedgerListener listener : listeners) {
            try {
                listener.onAppend(entry);
            } catch (RuntimeException e) {
                // the event is committed; a listener failure must not surface as an append failure
                log.error("Ledger listener {} failed for event {}", listener, entry.event().id(), e);
            }
        }
    }

    private void reject(String tenantId, String reason) {
        metrics.tenantCounter("revenue.events.rejected", "Revenue events rejected at append",
                tenantId, "reason", reason).increment();
    }

    private static final class Partition {
        private final ReentrantLock lock = new ReentrantLock();
        private final List<RevenueEvent> events = new CopyOnWriteArrayList<>();
        private volatile int committed;
    }
}
