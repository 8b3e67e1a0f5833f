package com.fairway.revenue.metrics;

import com.fairway.revenue.period.RevenuePeriod;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest computed {@link RevenueMetrics} per (ledger, tenant, period).
 * <p>
 * An entry is only served for the ledger version it was computed at; any later append for the
 * tenant changes the version and turns the entry into a miss. Only snapshots taken from a ledger
 * belong here: a version is meaningless without the ledger it counts.
 */
public class MetricsSnapshotCache {

    private final Map<Key, RevenueMetrics> entries = new ConcurrentHashMap<>();

    public Optional<RevenueMetrics> get(String ledgerId, String tenantId, RevenuePeriod period, long ledgerVersion) {
        RevenueMetrics cached = entries.get(new Key(ledgerId, tenantId, period));
        if (cached == null || cached.ledgerVersion() != ledgerVersion) {
            return Optional.empty();
        }
        return Optional.of(cached);
    }

    public void put(String ledgerId, RevenueMetrics metrics) {
        entries.merge(new Key(ledgerId, metrics.tenantId(), metrics.period()), metrics,
                (old, fresh) -> fresh.ledgerVersion() >= old.ledgerVersion() ? fresh : old);
    }

    /** Drops every entry of {@code tenantId} (platform entries when null). */
    public void invalidate(String tenantId) {
        entries.keySet().removeIf(key -> Objects.equals(key.tenantId(), tenantId));
    }

    public int size() {
        return entries.size();
    }

    private record Key(String ledgerId, String tenantId, RevenuePeriod period) {
    }
}
