package com.fairway.revenue.signal;

/**
 * Handle returned by {@link RevenueSignalPublisher#subscribe}. Cancelling is idempotent.
 */
public interface Subscription extends AutoCloseable {

    void cancel();

    boolean isActive();

    @Override
    default void close() {
        cancel();
    }
}
