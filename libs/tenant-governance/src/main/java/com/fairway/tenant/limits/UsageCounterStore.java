package com.fairway.tenant.limits;

/**
 * Externally fed consumption counters for the current billing period.
 */
public interface UsageCounterStore {

    /**
     * Adds {@code amount} to a counter and returns the new value.
     *
     * @throws IllegalArgumentException if amount is negative
     */
    long increment(String tenantId, GovernedResource resource, long amount);

    /** Overwrites a gauge-style counter such as storage or user count. */
    void set(String tenantId, GovernedResource resource, long value);

    /** Consumption of the current billing period; empty for an unknown tenant. */
    TenantUsage current(String tenantId);
}
