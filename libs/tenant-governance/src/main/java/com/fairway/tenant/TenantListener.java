package com.fairway.tenant;

import com.fairway.tenant.limits.GovernedResource;

import java.math.BigDecimal;

/**
 * Callbacks for tenant governance changes. Every method defaults to a no-op so a listener only
 * overrides what it cares about.
 * <p>
 * Invoked synchronously on the thread that made the change, after the change is stored. A
 * failing listener is logged and never undoes the change.
 */
public interface TenantListener {

    default void tenantCreated(Tenant tenant) {
    }

    /** Profile, limits or position in the hierarchy changed. */
    default void tenantUpdated(Tenant tenant) {
    }

    /** Any lifecycle transition, deletion included. The tenant already carries {@code to}. */
    default void statusChanged(Tenant tenant, TenantStatus from, TenantStatus to) {
    }

    /**
     * A usage record pushed consumption of a bounded resource past its effective limit. Fired once
     * per crossing within a billing period.
     */
    default void usageExceededLimit(Tenant tenant, GovernedResource resource, long usage, long limit) {
    }

    /** A fresh health score differs from the previous one. */
    default void healthScoreChanged(Tenant tenant, BigDecimal previousScore, BigDecimal newScore) {
    }
}
