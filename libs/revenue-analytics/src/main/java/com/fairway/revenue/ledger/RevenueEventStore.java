package com.fairway.revenue.ledger;

import com.fairway.eventmodel.DateRange;
import com.fairway.eventmodel.RevenueEvent;

import java.util.List;

/**
 * Append-only, tenant-partitioned ledger of revenue events.
 */
public interface RevenueEventStore {

    /**
     * Validates and appends an event.
     *
     * @return the global sequence assigned to the event
     * @throws com.fairway.revenue.RevenueException DUPLICATE_EVENT or INVALID_EVENT
     */
    long append(RevenueEvent event);

    /**
     * Events of {@code tenantId} (all tenants when null) in {@code range}, ordered by timestamp
     * then id.
     *
     * @throws com.fairway.revenue.RevenueException INVALID_DATE_RANGE before reading anything
     */
    List<RevenueEvent> query(String tenantId, DateRange range);

    /** Point-in-time view of everything appended so far. */
    LedgerSnapshot snapshot();

    void addListener(LedgerListener listener);

    void removeListener(LedgerListener listener);
}
