package com.fairway.revenue.metrics;

import com.fairway.eventmodel.RevenueCategory;
import com.fairway.eventmodel.RevenueEvent;
import com.fairway.eventmodel.RevenueEventType;
import com.fairway.revenue.RevenueException;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Signed sums of a set of events, per category and per event type.
 *
 * <p>Addition of decimals is exact, so totals do not depend on the order of the events.
 *
 * @param currency   the single currency of the events, null when there are none
 * @param recurring  created + renewed + upgraded − downgraded
 * @param usage      usage charges
 * @param oneTime    one-time payments, setup fees and add-ons
 * @param refunds    refunds, chargebacks and credits, as a positive magnitude
 * @param byType     signed contribution per event type
 * @param eventCount number of events, cancellations included
 */
public record RevenueTotals(
        String currency,
        BigDecimal recurring,
        BigDecimal usage,
        BigDecimal oneTime,
        BigDecimal refunds,
        Map<RevenueEventType, BigDecimal> byType,
        long eventCount) {

    public RevenueTotals {
        byType = Map.copyOf(byType);
    }

    public static final RevenueTotals EMPTY = new RevenueTotals(null, BigDecimal.ZERO, BigDecimal.ZERO,
            BigDecimal.ZERO, BigDecimal.ZERO, Map.of(), 0);

    /**
     * @throws RevenueException CALCULATION_ERROR when the events use more than one currency
     */
    public static RevenueTotals of(Collection<RevenueEvent> events) {
        String currency = null;
        BigDecimal recurring = BigDecimal.ZERO;
        BigDecimal usage = BigDecimal.ZERO;
        BigDecimal oneTime = BigDecimal.ZERO;
        BigDecimal refunds = BigDecimal.ZERO;
        Map<RevenueEventType, BigDecimal> byType = new EnumMap<>(RevenueEventType.class);

        for (RevenueEvent event : events) {
            currency = requireSameCurrency(currency, event.currency());
            BigDecimal contribution = event.contribution();
            byType.merge(event.type(), contribution, BigDecimal::add);
            RevenueCategory category = event.type().category();
            switch (category) {
                case RECURRING -> recurring = recurring.add(contribution);
                case USAGE -> usage = usage.add(contribution);
                case ONE_TIME -> oneTime = oneTime.add(contribution);
                case REFUND -> refunds = refunds.add(contribution.negate());
                case LIFECYCLE -> {
                    // cancellations carry no money
                }
                default -> throw new IllegalStateException("Unhandled category " + category);
            }
        }
        return new RevenueTotals(currency, recurring, usage, oneTime, refunds, byType, events.size());
    }

    /** recurring + usage + one-time. */
    public BigDecimal gross() {
        return recurring.add(usage).add(oneTime);
    }

    /** gross − refunds. */
    public BigDecimal net() {
        return gross().subtract(refunds);
    }

    public BigDecimal forCategory(RevenueCategory category) {
        return switch (category) {
            case RECURRING -> recurring;
            case USAGE -> usage;
            case ONE_TIME -> oneTime;
            case REFUND -> refunds;
            case LIFECYCLE -> BigDecimal.ZERO;
        };
    }

    public BigDecimal forType(RevenueEventType type) {
        return byType.getOrDefault(type, BigDecimal.ZERO);
    }

    public boolean isEmpty() {
        return eventCount == 0;
    }

    /**
     * Currency shared by both sides. A null side is an empty window and matches any currency.
     *
     * @throws RevenueException CALCULATION_ERROR when both sides carry different currencies
     */
    public static String requireSameCurrency(String known, String next) {
        if (known == null) {
            return next;
        }
        if (next == null || known.equals(next)) {
            return known;
        }
        throw RevenueException.calculationError(
                "mixed currencies " + known + " and " + next + " in one window; convert before aggregating");
    }
}
