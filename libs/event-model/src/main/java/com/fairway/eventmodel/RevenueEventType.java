package com.fairway.eventmodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Closed set of monetary event types recorded in the revenue ledger.
 *
 * <p>Each type fixes its {@link Polarity} and {@link RevenueCategory}; aggregation code switches on
 * the category and never on the type name.
 */
public enum RevenueEventType {

    // ---- Subscription lifecycle ----
    SUBSCRIPTION_CREATED("subscription_created", Polarity.POSITIVE, RevenueCategory.RECURRING),
    SUBSCRIPTION_RENEWED("subscription_renewed", Polarity.POSITIVE, RevenueCategory.RECURRING),
    SUBSCRIPTION_UPGRADED("subscription_upgraded", Polarity.POSITIVE, RevenueCategory.RECURRING),
    SUBSCRIPTION_DOWNGRADED("subscription_downgraded", Polarity.NEGATIVE, RevenueCategory.RECURRING),
    SUBSCRIPTION_CANCELLED("subscription_cancelled", Polarity.NEUTRAL, RevenueCategory.LIFECYCLE),

    // ---- Charges ----
    USAGE_CHARGE("usage_charge", Polarity.POSITIVE, RevenueCategory.USAGE),
    ONE_TIME_PAYMENT("one_time_payment", Polarity.POSITIVE, RevenueCategory.ONE_TIME),
    SETUP_FEE("setup_fee", Polarity.POSITIVE, RevenueCategory.ONE_TIME),
    ADD_ON_PURCHASE("addon_purchase", Polarity.POSITIVE, RevenueCategory.ONE_TIME),

    // ---- Money returned ----
    REFUND("refund", Polarity.NEGATIVE, RevenueCategory.REFUND),
    CHARGEBACK("chargeback", Polarity.NEGATIVE, RevenueCategory.REFUND),
    CREDIT("credit", Polarity.NEGATIVE, RevenueCategory.REFUND);

    private final String value;
    private final Polarity polarity;
    private final RevenueCategory category;

    RevenueEventType(String value, Polarity polarity, RevenueCategory category) {
        this.value = value;
        this.polarity = polarity;
        this.category = category;
    }

    /** Wire name, e.g. {@code "subscription_created"}. */
    @JsonValue
    public String value() {
        return value;
    }

    public Polarity polarity() {
        return polarity;
    }

    public RevenueCategory category() {
        return category;
    }

    /** True for the four types that start, extend or change a subscription's recurring amount. */
    public boolean isSubscriptionLifecycle() {
        return category == RevenueCategory.RECURRING || this == SUBSCRIPTION_CANCELLED;
    }

    public static Optional<RevenueEventType> fromString(String value) {
        for (RevenueEventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static RevenueEventType fromJson(String value) {
        return fromString(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown revenue event type: " + value));
    }
}
