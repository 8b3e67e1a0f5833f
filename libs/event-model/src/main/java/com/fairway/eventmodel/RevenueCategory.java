package com.fairway.eventmodel;

/**
 * Revenue bucket an event type is aggregated into.
 */
public enum RevenueCategory {
    /** Subscription revenue: created, renewed, upgraded, downgraded. */
    RECURRING,
    /** Metered usage charges. */
    USAGE,
    /** One-time payments, setup fees and add-on purchases. */
    ONE_TIME,
    /** Refunds, chargebacks and credits; subtracted from gross. */
    REFUND,
    /** Lifecycle only, carries no money (cancellation). */
    LIFECYCLE
}
