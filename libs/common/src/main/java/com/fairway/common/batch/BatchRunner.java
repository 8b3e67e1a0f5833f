package com.fairway.common.batch;

import com.fairway.common.ErrorKind;
import com.fairway.common.FairwayException;
import com.fairway.observability.CorrelationContextHolder;
import com.fairway.observability.SpanHelper;
import io.opentelemetry.api.trace.SpanKind;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one unit of work per key (typically per tenant) concurrently and collects an explicit
 * pass/fail outcome for each.
 *
 * <p>A failing item never aborts its siblings. Each item runs inside its own span and under the
 * submitter's correlation context.
 */
public final class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final Executor executor;
    private final SpanHelper spanHelper;

    /**
     * @param executor   executor the items run on
     * @param spanHelper tracing helper used to wrap every item
     */
    public BatchRunner(Executor executor, SpanHelper spanHelper) {
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        if (spanHelper == null) {
            throw new IllegalArgumentException("spanHelper must not be null");
        }
        this.executor = executor;
        this.spanHelper = spanHelper;
    }

    /**
     * Starts a batch job and returns immediately.
     *
     * @param batchName logical job name, used for spans and logs
     * @param keys      distinct item keys
     * @param work      computation per key
     * @throws IllegalArgumentException if keys contain duplicates
     */
    public <K, T> BatchExecution<K, T> submit(
            String batchName, Collection<K> keys, Function<K, T> work) {
        var distinct = new LinkedHashSet<>(keys);
        if (distinct.size() != keys.size()) {
            throw new IllegalArgumentException("batch keys must be distinct");
        }
        var cancelled = new AtomicBoolean(false);
        Map<K, CompletableFuture<ItemOutcome<K, T>>> futures = new LinkedHashMap<>();
        for (K key : distinct) {
            futures.put(
                    key,
                    CompletableFuture.supplyAsync(
                            CorrelationContextHolder.propagate(
                                    () -> runItem(batchName, key, work, cancelled)),
                            executor));
        }
        log.debug("Submitted batch {} with {} items", batchName, futures.size());
        return new BatchExecution<>(batchName, futures, cancelled);
    }

    /** Runs a batch job to completion. */
    public <K, T> BatchResult<K, T> run(String batchName, Collection<K> keys, Function<K, T> work) {
        BatchResult<K, T> result = submit(batchName, keys, work).await();
        log.info(
                "Batch {} finished: {} succeeded, {} failed, {} cancelled",
                batchName,
                result.succeeded(),
                result.failed(),
                result.cancelled());
        return result;
    }

    private <K, T> ItemOutcome<K, T> runItem(
            String batchName, K key, Function<K, T> work, AtomicBoolean cancelled) {
        if (cancelled.get()) {
            return ItemOutcome.cancelled(key);
        }
        try {
            T value =
                    spanHelper.inSpan(
                            batchName + ".item",
                            SpanKind.INTERNAL,
                            Map.of("batch.name", batchName, "batch.item", String.valueOf(key)),
                            () -> work.apply(key));
            return ItemOutcome.succeeded(key, value);
        } catch (FairwayException e) {
            log.warn("Batch {} item {} failed: {}", batchName, key, e.getMessage());
            return ItemOutcome.failed(key, e.kind(), e.code(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Batch {} item {} failed unexpectedly", batchName, key, e);
            return ItemOutcome.failed(key, ErrorKind.COMPUTATION, "UNEXPECTED", e.getMessage());
        }
    }
}
