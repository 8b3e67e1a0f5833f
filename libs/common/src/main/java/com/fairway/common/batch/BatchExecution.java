package com.fairway.common.batch;

import com.fairway.common.ErrorKind;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on a running batch job.
 *
 * <p>{@link #cancel()} prevents items that have not started yet from running; items already in
 * flight finish normally. {@link #await(Duration)} reports unfinished items as cancelled when the
 * deadline passes.
 *
 * @param <K> key type
 * @param <T> value type
 */
public final class BatchExecution<K, T> {

    private final String batchName;
    private final Map<K, CompletableFuture<ItemOutcome<K, T>>> futures;
    private final AtomicBoolean cancelled;

    BatchExecution(
            String batchName,
            Map<K, CompletableFuture<ItemOutcome<K, T>>> futures,
            AtomicBoolean cancelled) {
        this.batchName = batchName;
        this.futures = new LinkedHashMap<>(futures);
        this.cancelled = cancelled;
    }

    /** Requests cancellation. Items not yet started complete as {@link OutcomeStatus#CANCELLED}. */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Waits for every item and collects the outcomes. */
    public BatchResult<K, T> await() {
        List<ItemOutcome<K, T>> outcomes = new ArrayList<>(futures.size());
        futures.values().forEach(future -> outcomes.add(future.join()));
        return new BatchResult<>(batchName, outcomes);
    }

    /**
     * Waits at most {@code timeout} for the whole batch. Items still unfinished at the deadline are
     * reported as cancelled and the batch is cancelled.
     */
    public BatchResult<K, T> await(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        List<ItemOutcome<K, T>> outcomes = new ArrayList<>(futures.size());
        for (Map.Entry<K, CompletableFuture<ItemOutcome<K, T>>> entry : futures.entrySet()) {
            long remaining = Math.max(0, deadline - System.nanoTime());
            try {
                outcomes.add(entry.getValue().get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                cancel();
                outcomes.add(ItemOutcome.cancelled(entry.getKey()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancel();
                outcomes.add(ItemOutcome.cancelled(entry.getKey()));
            } catch (ExecutionException e) {
                // only an Error escaping runItem lands here
                outcomes.add(
                        ItemOutcome.failed(
                                entry.getKey(),
                                ErrorKind.COMPUTATION,
                                "UNEXPECTED",
                                String.valueOf(e.getCause())));
            }
        }
        return new BatchResult<>(batchName, outcomes);
    }

    public String batchName() {
        return batchName;
    }
}
