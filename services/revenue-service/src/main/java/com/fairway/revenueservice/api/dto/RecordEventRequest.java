package com.fairway.revenueservice.api.dto;

import com.fairway.eventmodel.RevenueEvent;
import com.fairway.eventmodel.RevenueEventType;
import com.fairway.eventmodel.RevenueSource;
import com.fairway.revenue.RevenueException;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Body of {@code POST /api/v1/revenue/tenants/{tenantId}/events}.
 *
 * <p>{@code id} is optional; clients that retry should send one so that a replay is rejected as a
 * duplicate. A missing {@code timestamp} means "now" and a missing {@code source} means manual.
 */
public record RecordEventRequest(
        UUID id,
        @NotBlank String type,
        @NotNull BigDecimal amount,
        @NotBlank String currency,
        Instant timestamp,
        String subscriptionId,
        String customerId,
        String invoiceId,
        Map<String, String> metadata,
        String source) {

    public RevenueEvent toEvent(String tenantId, Instant now) {
        RevenueEventType eventType = RevenueEventType.fromString(type)
                .orElseThrow(() -> RevenueException.invalidEvent("unknown event type: " + type));
        RevenueSource eventSource = source == null
                ? RevenueSource.MANUAL
                : RevenueSource.fromString(source)
                        .orElseThrow(() -> RevenueException.invalidEvent("unknown source: " + source));
        return new RevenueEvent(
                id == null ? UUID.randomUUID() : id,
                tenantId,
                eventType,
                amount,
                currency,
                timestamp == null ? now : timestamp,
                subscriptionId,
                customerId,
                invoiceId,
                metadata,
                eventSource);
    }
}
