package com.fairway.revenue.ledger;

import com.fairway.eventmodel.DateRange;
import com.fairway.eventmodel.RevenueEvent;
import com.fairway.revenue.RevenueException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Immutable view of the ledger as of one instant.
 *
 * <p>For each tenant partition the snapshot remembers how many entries were committed when it was
 * taken and never reads past that count, so appends made afterwards are invisible. Reads never
 * lock.
 */
public final class LedgerSnapshot {

    /** Canonical event order: timestamp, then id. */
    public static final Comparator<RevenueEvent> EVENT_ORDER =
            Comparator.comparing(RevenueEvent::timestamp).thenComparing(RevenueEvent::id);

    private final String ledgerId;
    private final Instant asOf;
    private final Map<String, List<RevenueEvent>> partitions;
    private final Map<String, Integer> counts;

    /**
     * @param ledgerId   identity of the ledger the snapshot was taken from, null for fixed event lists
     * @param asOf       wall-clock time the snapshot was taken
     * @param partitions tenant partitions; only the first {@code counts.get(tenant)} entries are read
     * @param counts     committed entry count per tenant
     */
    LedgerSnapshot(String ledgerId, Instant asOf, Map<String, List<RevenueEvent>> partitions,
                   Map<String, Integer> counts) {
        this.ledgerId = ledgerId;
        this.asOf = asOf;
        this.partitions = Map.copyOf(partitions);
        this.counts = Collections.unmodifiableMap(new TreeMap<>(counts));
    }

    /**
     * Builds a snapshot over fixed event lists; for tests and replays. Such a snapshot belongs to no
     * ledger, so its version says nothing about its content.
     */
    public static LedgerSnapshot of(Instant asOf, List<RevenueEvent> events) {
        Map<String, List<RevenueEvent>> partitions = new TreeMap<>();
        for (RevenueEvent event : events) {
            partitions.computeIfAbsent(event.tenantId(), k -> new ArrayList<>()).add(event);
        }
        Map<String, Integer> counts = new TreeMap<>();
        partitions.forEach((tenant, list) -> counts.put(tenant, list.size()));
        return new LedgerSnapshot(null, asOf, partitions, counts);
    }

    /**
     * Identity of the append-only ledger behind this snapshot. Two snapshots with the same ledger id
     * and the same {@link #version(String)} see the same events. Empty for replays.
     */
    public Optional<String> ledgerId() {
        return Optional.ofNullable(ledgerId);
    }

    public Instant asOf() {
        return asOf;
    }

    /** Tenants with at least one event, sorted. */
    public Set<String> tenantIds() {
        return counts.keySet();
    }

    /**
     * Number of events visible for {@code tenantId}, or across all tenants when null. Because the
     * ledger is append-only this identifies the visible prefix exactly.
     */
    public long version(String tenantId) {
        if (tenantId != null) {
            return counts.getOrDefault(tenantId, 0);
        }
        long total = 0;
        for (int count : counts.values()) {
            total += count;
        }
        return total;
    }

    /**
     * @throws RevenueException INVALID_DATE_RANGE when the range is inverted
     */
    public List<RevenueEvent> query(String tenantId, DateRange range) {
        if (!range.isValid()) {
            throw RevenueException.invalidDateRange(range);
        }
        List<RevenueEvent> result = new ArrayList<>();
        forEachVisible(tenantId, event -> {
            if (range.contains(event.timestamp())) {
                result.add(event);
            }
        });
        result.sort(EVENT_ORDER);
        return result;
    }

    /** Every visible event of the tenant (all tenants when null), in canonical order. */
    public List<RevenueEvent> events(String tenantId) {
        List<RevenueEvent> result = new ArrayList<>();
        forEachVisible(tenantId, result::add);
        result.sort(EVENT_ORDER);
        return result;
    }

    /** Earliest event timestamp of the tenant (all tenants when null). */
    public Optional<Instant> firstEventAt(String tenantId) {
        Instant[] earliest = new Instant[1];
        forEachVisible(tenantId, event -> {
            if (earliest[0] == null || event.timestamp().isBefore(earliest[0])) {
                earliest[0] = event.timestamp();
            }
        });
        return Optional.ofNullable(earliest[0]);
    }

    private void forEachVisible(String tenantId, Consumer<RevenueEvent> action) {
        if (tenantId != null) {
            visit(tenantId, action);
            return;
        }
        for (String tenant : counts.keySet()) {
            visit(tenant, action);
        }
    }

    private void visit(String tenantId, Consumer<RevenueEvent> action) {
        List<RevenueEvent> partition = partitions.get(tenantId);
        int count = counts.getOrDefault(tenantId, 0);
        for (int i = 0; i < count; i++) {
            action.accept(partition.get(i));
        }
    }
}
