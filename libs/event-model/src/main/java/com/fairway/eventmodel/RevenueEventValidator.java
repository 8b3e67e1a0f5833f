package com.fairway.eventmodel;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Currency;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a {@link RevenueEvent} before it is admitted to the ledger.
 *
 * <p>Validation is manual and collects every problem into a {@link ValidationResult}. Rules:
 * required fields present, amount scale at most {@value #MAX_SCALE}, currency a known ISO 4217
 * code, timestamp not later than now plus the clock-skew tolerance, and the amount's sign agreeing
 * with the type's polarity.
 */
public final class RevenueEventValidator {

    /** Maximum number of decimal places accepted on an amount. */
    public static final int MAX_SCALE = 4;

    /** Default tolerance for producer clocks running ahead of ours. */
    public static final Duration DEFAULT_CLOCK_SKEW = Duration.ofMinutes(5);

    private static final Set<String> ISO_CURRENCIES = Currency.getAvailableCurrencies().stream()
            .map(Currency::getCurrencyCode)
            .collect(Collectors.toUnmodifiableSet());

    private final Clock clock;
    private final Duration clockSkew;

    public RevenueEventValidator(Clock clock) {
        this(clock, DEFAULT_CLOCK_SKEW);
    }

    public RevenueEventValidator(Clock clock, Duration clockSkew) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (clockSkew == null || clockSkew.isNegative()) {
            throw new IllegalArgumentException("clockSkew must be zero or positive");
        }
        this.clock = clock;
        this.clockSkew = clockSkew;
    }

    public ValidationResult validate(RevenueEvent event) {
        if (event == null) {
            return ValidationResult.fail(List.of("event must not be null"));
        }
        var errors = new ArrayList<String>();

        if (event.id() == null) {
            errors.add("id must not be null");
        }
        if (event.tenantId() == null || event.tenantId().isBlank()) {
            errors.add("tenantId must not be null or blank");
        }
        if (event.type() == null) {
            errors.add("type must not be null");
        }
        if (event.source() == null) {
            errors.add("source must not be null");
        }

        BigDecimal amount = event.amount();
        if (amount == null) {
            errors.add("amount must not be null");
        } else {
            if (amount.stripTrailingZeros().scale() > MAX_SCALE) {
                errors.add("amount must have at most " + MAX_SCALE + " decimal places");
            }
            if (event.type() != null && amount.signum() < 0
                    && event.type().polarity() != Polarity.NEGATIVE) {
                errors.add("negative amount not allowed for " + event.type().value());
            }
        }

        if (event.currency() == null || !ISO_CURRENCIES.contains(event.currency())) {
            errors.add("currency must be an ISO 4217 code");
        }

        if (event.timestamp() == null) {
            errors.add("timestamp must not be null");
        } else {
            Instant latest = clock.instant().plus(clockSkew);
            if (event.timestamp().isAfter(latest)) {
                errors.add("timestamp lies in the future beyond the " + clockSkew.toMinutes()
                        + " minute clock-skew tolerance");
            }
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    public Duration clockSkew() {
        return clockSkew;
    }
}
