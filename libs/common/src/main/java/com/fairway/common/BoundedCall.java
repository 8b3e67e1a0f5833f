package com.fairway.common;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs a call into an external collaborator (document encoder, SLO feed, data migrator) with a
 * hard timeout.
 *
 * <p>Failures and timeouts are wrapped in a {@link FairwayException} of kind {@link
 * ErrorKind#UPSTREAM} with the original cause attached. Nothing is retried here: retry policy
 * belongs to the caller.
 */
public final class BoundedCall {

    /** Default timeout for collaborator calls (5 seconds). */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final Duration timeout;
    private final Executor executor;

    public BoundedCall() {
        this(DEFAULT_TIMEOUT, ForkJoinPool.commonPool());
    }

    public BoundedCall(Duration timeout) {
        this(timeout, ForkJoinPool.commonPool());
    }

    /**
     * @param timeout  maximum time to wait for the collaborator
     * @param executor executor the call runs on
     */
    public BoundedCall(Duration timeout, Executor executor) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        this.timeout = timeout;
        this.executor = executor;
    }

    /**
     * Invokes the collaborator and waits at most {@link #timeout()}.
     *
     * @param collaborator name used in the error message (e.g. "export-encoder")
     * @param call         the collaborator invocation
     * @param <T>          result type
     * @return the collaborator's result
     * @throws FairwayException with kind UPSTREAM on timeout or collaborator failure; a {@code
     *     FairwayException} thrown by the collaborator itself is rethrown unchanged
     */
    public <T> T call(String collaborator, Supplier<T> call) {
        try {
            return CompletableFuture.supplyAsync(call, executor)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof FairwayException fe) {
                throw fe;
            }
            if (cause instanceof TimeoutException) {
                throw new FairwayException(
                        ErrorKind.UPSTREAM,
                        "UPSTREAM_TIMEOUT",
                        "%s did not respond within %d ms"
                                .formatted(collaborator, timeout.toMillis()),
                        cause);
            }
            throw new FairwayException(
                    ErrorKind.UPSTREAM,
                    "UPSTREAM_FAILURE",
                    "%s failed: %s".formatted(collaborator, cause.getMessage()),
                    cause);
        }
    }

    /** Returns the configured timeout. */
    public Duration timeout() {
        return timeout;
    }
}
