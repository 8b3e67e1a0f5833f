package com.fairway.eventmodel;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One immutable entry of the revenue ledger.
 *
 * <p>Events are never updated or deleted; a correction is a new compensating event (see {@link
 * RevenueEventFactory#refundOf}). The amount may be given as a magnitude or already signed with the
 * type's polarity; {@link #contribution()} normalizes both forms.
 *
 * @param id             unique identity, used for duplicate detection
 * @param tenantId       owning tenant
 * @param type           event type
 * @param amount         monetary amount, at most four decimals
 * @param currency       ISO 4217 code
 * @param timestamp      when the money moved
 * @param subscriptionId subscription this event belongs to, if any
 * @param customerId     paying customer, if known
 * @param invoiceId      invoice the money was collected against, if any
 * @param metadata       free-form attributes ({@code tier}, {@code region}, ...)
 * @param source         collection channel
 */
public record RevenueEvent(
        UUID id,
        String tenantId,
        RevenueEventType type,
        BigDecimal amount,
        String currency,
        Instant timestamp,
        String subscriptionId,
        String customerId,
        String invoiceId,
        Map<String, String> metadata,
        RevenueSource source) {

    public RevenueEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** Signed effect on net revenue: {@code polarity × |amount|}. */
    @JsonIgnore
    public BigDecimal contribution() {
        return amount.abs().multiply(BigDecimal.valueOf(type.polarity().signum()));
    }

    /** {@code |amount|}. */
    @JsonIgnore
    public BigDecimal magnitude() {
        return amount.abs();
    }

    /** Metadata value or {@code null}. */
    public String attribute(String key) {
        return metadata.get(key);
    }
}
