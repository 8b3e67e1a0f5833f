package com.fairway.common.batch;

import java.util.List;
import java.util.Optional;

/**
 * Collected outcomes of a batch job, in submission order.
 *
 * @param batchName logical job name (e.g. "revenue.forecast")
 * @param outcomes  one outcome per submitted key
 * @param <K>       key type
 * @param <T>       value type
 */
public record BatchResult<K, T>(String batchName, List<ItemOutcome<K, T>> outcomes) {

    public BatchResult {
        outcomes = List.copyOf(outcomes);
    }

    public long succeeded() {
        return count(OutcomeStatus.SUCCEEDED);
    }

    public long failed() {
        return count(OutcomeStatus.FAILED);
    }

    public long cancelled() {
        return count(OutcomeStatus.CANCELLED);
    }

    public int total() {
        return outcomes.size();
    }

    /** Returns the outcome for a key, if it was part of the batch. */
    public Optional<ItemOutcome<K, T>> outcome(K key) {
        return outcomes.stream().filter(o -> o.key().equals(key)).findFirst();
    }

    /** Returns the successful values in submission order. */
    public List<T> values() {
        return outcomes.stream().filter(ItemOutcome::isSuccess).map(ItemOutcome::value).toList();
    }

    private long count(OutcomeStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }
}
