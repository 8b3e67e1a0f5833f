package com.fairway.eventmodel;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Factory methods for {@link RevenueEvent}.
 */
public final class RevenueEventFactory {

    private RevenueEventFactory() {
        // utility class
    }

    /**
     * Creates an event with a random id and no subscription, customer or invoice reference.
     */
    public static RevenueEvent create(String tenantId, RevenueEventType type, BigDecimal amount,
                                      String currency, Instant timestamp, RevenueSource source) {
        return new RevenueEvent(UUID.randomUUID(), tenantId, type, amount, currency, timestamp,
                null, null, null, Map.of(), source);
    }

    /**
     * Creates a subscription event for a customer.
     */
    public static RevenueEvent subscription(String tenantId, RevenueEventType type,
                                            String subscriptionId, String customerId,
                                            BigDecimal amount, String currency, Instant timestamp) {
        if (!type.isSubscriptionLifecycle()) {
            throw new IllegalArgumentException(type.value() + " is not a subscription event");
        }
        return new RevenueEvent(UUID.randomUUID(), tenantId, type, amount, currency, timestamp,
                subscriptionId, customerId, null, Map.of(), RevenueSource.STRIPE);
    }

    /**
     * Creates the compensating refund for a previously recorded charge. The refund references the
     * original invoice and customer so that it reconciles against the charge.
     *
     * @param original the charge being refunded
     * @param amount   refunded magnitude, at most the original magnitude
     * @param at       when the refund was issued
     */
    public static RevenueEvent refundOf(RevenueEvent original, BigDecimal amount, Instant at) {
        if (original.type().polarity() != Polarity.POSITIVE) {
            throw new IllegalArgumentException("only positive events can be refunded");
        }
        if (amount.abs().compareTo(original.magnitude()) > 0) {
            throw new IllegalArgumentException("refund exceeds the original amount");
        }
        return new RevenueEvent(UUID.randomUUID(), original.tenantId(), RevenueEventType.REFUND,
                amount.abs(), original.currency(), at, original.subscriptionId(),
                original.customerId(), original.invoiceId(), original.metadata(), original.source());
    }
}
