package com.fairway.revenue.ledger;

/**
 * Callback invoked after every accepted append.
 * <p>
 * Invoked on the appending thread once the entry is visible to new snapshots. Listeners for
 * concurrent appends to the same tenant may observe entries out of partition order; use
 * {@link LedgerEntry#partitionIndex()} to reconcile against a snapshot.
 */
@FunctionalInterface
public interface LedgerListener {

    void onAppend(LedgerEntry entry);
}
