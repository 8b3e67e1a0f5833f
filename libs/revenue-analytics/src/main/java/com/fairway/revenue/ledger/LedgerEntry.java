package com.fairway.revenue.ledger;

import com.fairway.eventmodel.RevenueEvent;

/**
 * An accepted event together with its position in the ledger.
 *
 * @param sequence       global, strictly increasing append sequence
 * @param partitionIndex zero-based position within the tenant's partition
 * @param event          the event
 */
public record LedgerEntry(long sequence, int partitionIndex, RevenueEvent event) {
}
