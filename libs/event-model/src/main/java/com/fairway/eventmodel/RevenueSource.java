package com.fairway.eventmodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/** Channel through which a revenue event was collected. */
public enum RevenueSource {
    STRIPE("stripe"),
    APPLE_PAY("apple_pay"),
    GOOGLE_PAY("google_pay"),
    BANK_TRANSFER("bank_transfer"),
    INVOICE("invoice"),
    MANUAL("manual"),
    MIGRATION("migration");

    private final String value;

    RevenueSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<RevenueSource> fromString(String value) {
        for (RevenueSource source : values()) {
            if (source.value.equals(value)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static RevenueSource fromJson(String value) {
        return fromString(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown revenue source: " + value));
    }
}
