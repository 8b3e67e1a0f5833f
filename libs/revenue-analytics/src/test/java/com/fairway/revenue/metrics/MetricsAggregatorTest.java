package com.fairway.revenue.metrics;

import static com.fairway.revenue.RevenueFixtures.CLUB;
import static com.fairway.revenue.RevenueFixtures.OTHER_CLUB;
import static com.fairway.revenue.RevenueFixtures.at;
import static com.fairway.revenue.RevenueFixtures.customerEvent;
import static com.fairway.revenue.RevenueFixtures.event;
import static com.fairway.revenue.RevenueFixtures.subscription;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fairway.eventmodel.DateRange;
import com.fairway.eventmodel.RevenueEvent;
import com.fairway.eventmodel.RevenueEventType;
import com.fairway.eventmodel.RevenueSource;
import com.fairway.revenue.MutableClock;
import com.fairway.revenue.RevenueException;
import com.fairway.revenue.RevenueFeatures;
import com.fairway.revenue.RevenueFixtures;
import com.fairway.revenue.ledger.InMemoryRevenueEventStore;
import com.fairway.revenue.ledger.LedgerSnapshot;
import com.fairway.revenue.period.RevenuePeriod;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MetricsAggregator")
class MetricsAggregatorTest {

    private static final Instant NOW = at("2024-06-15");
    private static final RevenuePeriod MAY = RevenuePeriod.month(YearMonth.of(2024, 5));

    private InMemoryRevenueEventStore store;
    private MetricsAggregator aggregator;

    @BeforeEach
    void setUp() {
        store = RevenueFixtures.store(new MutableClock(NOW));
        aggregator = RevenueFixtures.aggregator(store, RevenueFeatures.defaults());
    }

    private static List<RevenueEvent> tenSubscriptionsAndARefund() {
        List<RevenueEvent> events = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            events.add(subscription(CLUB, RevenueEventType.SUBSCRIPTION_CREATED, "sub-" + i, "cust-" + i,
                    "100", at("2024-05-0" + (i % 9 + 1))));
        }
        events.add(customerEvent(CLUB, RevenueEventType.REFUND, "50", at("2024-05-20"), "cust-0"));
        return events;
    }

    @Nested
    @DisplayName("buckets")
    class Buckets {

        @Test
        @DisplayName("ten $100 subscriptions and a $50 refund give net 950, 10 customers and ARPC 95")
        void canonicalMonth() {
            tenSubscriptionsAndARefund().forEach(store::append);

            RevenueMetrics metrics = aggregator.computeMetrics(MAY, CLUB);

            assertThat(metrics.totalRevenue()).isEqualByComparingTo("1000");
            assertThat(metrics.refunds()).isEqualByComparingTo("50");
            assertThat(metrics.netRevenue()).isEqualByComparingTo("950");
            assertThat(metrics.customerCount()).isEqualTo(10);
            assertThat(metrics.averageRevenuePerCustomer()).isEqualByComparingTo("95");
            assertThat(metrics.monthlyRecurringRevenue()).isEqualByComparingTo("1000");
            assertThat(metrics.annualRecurringRevenue()).isEqualByComparingTo("12000");
            assertThat(metrics.lifetimeValue()).isEqualByComparingTo("1140");
            assertThat(metrics.currency()).isEqualTo("USD");
            assertThat(metrics.eventCount()).isEqualTo(11);
        }

        @Test
        @DisplayName("downgrades reduce recurring revenue and credits count as refunds")
        void negativeTypes() {
            store.append(event(CLUB, RevenueEventType.SUBSCRIPTION_UPGRADED, "80", at("2024-05-02")));
            store.append(event(CLUB, RevenueEventType.SUBSCRIPTION_DOWNGRADED, "-30", at("2024-05-03")));
            store.append(event(CLUB, RevenueEventType.CREDIT, "5", at("2024-05-04")));
            store.append(event(CLUB, RevenueEventType.USAGE_CHARGE, "15", at("2024-05-05")));
            store.append(event(CLUB, RevenueEventType.SETUP_FEE, "25", at("2024-05-06")));

            RevenueMetrics metrics = aggregator.computeMetrics(MAY, CLUB);

            assertThat(metrics.recurringRevenue()).isEqualByComparingTo("50");
            assertThat(metrics.usageRevenue()).isEqualByComparingTo("15");
            assertThat(metrics.oneTimeRevenue()).isEqualByComparingTo("25");
            assertThat(metrics.refunds()).isEqualByComparingTo("5");
            assertThat(metrics.totalRevenue()).isEqualByComparingTo("90");
            assertThat(metrics.netRevenue()).isEqualByComparingTo("85");
        }

        @Test
        @DisplayName("quarterly recurring revenue is normalised to MRR and ARR")
        void quarterlyNormalisation() {
            store.append(event(CLUB, RevenueEventType.SUBSCRIPTION_CREATED, "600", at("2024-04-10")));
            store.append(event(CLUB, RevenueEventType.SUBSCRIPTION_RENEWED, "300", at("2024-05-10")));

            RevenueMetrics metrics = aggregator.computeMetrics(RevenuePeriod.quarter(2024, 2), CLUB);

            assertThat(metrics.monthlyRecurringRevenue()).isEqualByComparingTo("300");
            assertThat(metrics.annualRecurringRevenue()).isEqualByComparingTo("3600");
        }

        @Test
        @DisplayName("the first active month computes against an empty previous month")
        void firstPeriodAfterEmptyBaseline() {
            store.append(event(CLUB, RevenueEventType.ONE_TIME_PAYMENT, "40", at("2024-05-12")));

            RevenueMetrics metrics = aggregator.computeMetrics(MAY, CLUB);

            assertThat(metrics.currency()).isEqualTo("USD");
            assertThat(metrics.netRevenue()).isEqualByComparingTo("40");
            assertThat(metrics.growthRateDefined()).isFalse();
        }

        @Test
        @DisplayName("a month after a quiet month keeps the currency of its own events")
        void periodAfterQuietMonth() {
            store.append(event(CLUB, RevenueEventType.USAGE_CHARGE, "10", at("2024-03-12")));
            store.append(event(CLUB, RevenueEventType.USAGE_CHARGE, "25", at("2024-05-12")));

            RevenueMetrics metrics = aggregator.computeMetrics(MAY, CLUB);

            assertThat(metrics.currency()).isEqualTo("USD");
            assertThat(metrics.netRevenue()).isEqualByComparingTo("25");
        }

        @Test
        @DisplayName("a sub-second custom window normalises without dividing by zero")
        void subSecondCustomWindow() {
            Instant start = at("2024-05-10");
            store.append(event(CLUB, RevenueEventType.SUBSCRIPTION_CREATED, "100", start.plusMillis(100)));
            RevenuePeriod halfSecond = RevenuePeriod.custom(start, start.plusMillis(500));

            RevenueMetrics metrics = aggregator.computeMetrics(halfSecond, CLUB);

            assertThat(metrics.recurringRevenue()).isEqualByComparingTo("100");
            assertThat(metrics.monthlyRecurringRevenue()).isPositive();
            assertThat(metrics.annualRecurringRevenue()).isGreaterThan(metrics.monthlyRecurringRevenue());
        }
    }

    @Nested
    @DisplayName("purity")
    class Purity {

        @Test
        @DisplayName("the same events in a different order give an equal result")
        void orderIndependent() {
            List<RevenueEvent> events = tenSubscriptionsAndARefund();
            events.add(event(CLUB, RevenueEventType.USAGE_CHARGE, "12.3456", at("2024-04-11")));
            List<RevenueEvent> reversed = new ArrayList<>(events);
            Collections.reverse(reversed);

            InMemoryRevenueEventStore other = RevenueFixtures.store(new MutableClock(NOW));
            events.forEach(store::append);
            reversed.forEach(other::append);

            RevenueMetrics first = aggregator.computeMetrics(MAY, CLUB);
            RevenueMetrics second = RevenueFixtures.aggregator(other, RevenueFeatures.defaults())
                    .computeMetrics(MAY, CLUB);

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("repeated computation is idempotent with and without the cache")
        void idempotent() {
            tenSubscriptionsAndARefund().forEach(store::append);
            MetricsAggregator uncached = RevenueFixtures.aggregator(store,
                    RevenueFeatures.defaults().withCaching(false));

            RevenueMetrics cached = aggregator.computeMetrics(MAY, CLUB);

            assertThat(aggregator.computeMetrics(MAY, CLUB)).isEqualTo(cached);
            assertThat(uncached.computeMetrics(MAY, CLUB)).isEqualTo(cached);
        }

        @Test
        @DisplayName("a cached entry is not served after a later append")
        void cacheFollowsVersion() {
            tenSubscriptionsAndARefund().forEach(store::append);
            RevenueMetrics before = aggregator.computeMetrics(MAY, CLUB);

            store.append(event(CLUB, RevenueEventType.USAGE_CHARGE, "50", at("2024-05-28")));
            RevenueMetrics after = aggregator.computeMetrics(MAY, CLUB);

            assertThat(after.netRevenue()).isEqualByComparingTo(before.netRevenue().add(new BigDecimal("50")));
            assertThat(after.ledgerVersion()).isEqualTo(before.ledgerVersion() + 1);
        }

        @Test
        @DisplayName("replayed snapshots of equal size never share a cached result")
        void replaySnapshotsBypassCache() {
            LedgerSnapshot small = LedgerSnapshot.of(NOW,
                    List.of(event(CLUB, RevenueEventType.USAGE_CHARGE, "10", at("2024-05-05"))));
            LedgerSnapshot large = LedgerSnapshot.of(NOW,
                    List.of(event(CLUB, RevenueEventType.USAGE_CHARGE, "999", at("2024-05-05"))));

            RevenueMetrics first = aggregator.computeMetrics(small, MAY, CLUB, false);
            RevenueMetrics second = aggregator.computeMetrics(large, MAY, CLUB, false);

            assertThat(first.ledgerVersion()).isEqualTo(second.ledgerVersion());
            assertThat(first.netRevenue()).isEqualByComparingTo("10");
            assertThat(second.netRevenue()).isEqualByComparingTo("999");
        }

        @Test
        @DisplayName("two ledgers of equal size keep separate cache entries")
        void cacheIsPerLedger() {
            InMemoryRevenueEventStore other = RevenueFixtures.store(new MutableClock(NOW));
            store.append(event(CLUB, RevenueEventType.USAGE_CHARGE, "10", at("2024-05-05")));
            other.append(event(CLUB, RevenueEventType.USAGE_CHARGE, "70", at("2024-05-05")));

            RevenueMetrics own = aggregator.computeMetrics(store.snapshot(), MAY, CLUB, false);
            RevenueMetrics foreign = aggregator.computeMetrics(other.snapshot(), MAY, CLUB, false);

            assertThat(own.netRevenue()).isEqualByComparingTo("10");
            assertThat(foreign.netRevenue()).isEqualByComparingTo("70");
        }
    }

    @Nested
    @DisplayName("growth and churn")
    class GrowthAndChurn {

        @Test
        @DisplayName("growth compares against the previous bucket")
        void growth() {
            store.append(event(CLUB, RevenueEventType.USAGE_CHARGE, "500", at("2024-04-10")));
            tenSubscriptionsAndARefund().forEach(store::append);

            RevenueMetrics metrics = aggregator.computeMetrics(MAY, CLUB);

            assertThat(metrics.growthRateDefined()).isTrue();
            assertThat(metrics.growthRate()).isEqualByComparingTo("0.9");
        }

        @Test
        @DisplayName("a zero previous net leaves growth undefined")
        void growthSentinel() {
            tenSubscriptionsAndARefund().forEach(store::append);

            RevenueMetrics metrics = aggregator.computeMetrics(MAY, CLUB);

            assertThat(metrics.growthRateDefined()).isFalse();
            assertThat(metrics.growthRate()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("churn counts cancellations among subscriptions active at the period start")
        void cohortChurn() {
            for (String sub : List.of("a", "b", "c", "d")) {
                store.append(subscription(CLUB, RevenueEventType.SUBSCRIPTION_CREATED, sub, "cust-" + sub,
                        "100", at("2024-04-05")));
            }
            store.append(subscription(CLUB, RevenueEventType.SUBSCRIPTION_RENEWED, "b", "cust-b", "100",
                    at("2024-05-05")));
            store.append(subscription(CLUB, RevenueEventType.SUBSCRIPTION_CANCELLED, "a", "cust-a", "0",
                    at("2024-05-06")));
            store.append(subscription(CLUB, RevenueEventType.SUBSCRIPTION_CREATED, "x", "cust-x", "100",
                    at("2024-05-07")));
            store.append(subscription(CLUB, RevenueEventType.SUBSCRIPTION_CANCELLED, "x", "cust-x", "0",
                    at("2024-05-08")));

            RevenueMetrics metrics = aggregator.computeMetrics(MAY, CLUB);

            assertThat(metrics.churnRate()).isEqualByComparingTo("0.25");
            assertThat(metrics.customerCount()).isEqualTo(2);
            assertThat(metrics.lifetimeValue()).isEqualByComparingTo(
                    metrics.averageRevenuePerCustomer().multiply(BigDecimal.valueOf(4)));
        }

        @Test
        @DisplayName("subscription ids of different tenants do not collide")
        void churnIsTenantScoped() {
            store.append(subscription(CLUB, RevenueEventType.SUBSCRIPTION_CREATED, "s1", "c1", "100",
                    at("2024-04-05")));
            store.append(subscription(OTHER_CLUB, RevenueEventType.SUBSCRIPTION_CREATED, "s1", "c1", "100",
                    at("2024-04-05")));
            store.append(subscription(OTHER_CLUB, RevenueEventType.SUBSCRIPTION_CANCELLED, "s1", "c1", "0",
                    at("2024-05-05")));
            store.append(event(CLUB, RevenueEventType.USAGE_CHARGE, "10", at("2024-05-05")));

            assertThat(aggregator.computeMetrics(MAY, CLUB).churnRate()).isEqualByComparingTo("0");
            assertThat(aggregator.computeMetrics(MAY, null).churnRate()).isEqualByComparingTo("0.5");
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("an empty window is INSUFFICIENT_DATA unless a zero baseline is requested")
        void emptyWindow() {
            assertThatThrownBy(() -> aggregator.computeMetrics(MAY, CLUB))
                    .extracting(e -> ((RevenueException) e).code())
                    .isEqualTo(RevenueException.INSUFFICIENT_DATA);

            RevenueMetrics zero = aggregator.computeMetrics(store.snapshot(), MAY, CLUB, true);
            assertThat(zero.netRevenue()).isEqualByComparingTo("0");
            assertThat(zero.eventCount()).isZero();
        }

        @Test
        @DisplayName("mixed currencies are a CALCULATION_ERROR")
        void mixedCurrencies() {
            store.append(event(CLUB, RevenueEventType.USAGE_CHARGE, "10", at("2024-05-05")));
            store.append(new RevenueEvent(UUID.randomUUID(), CLUB, RevenueEventType.USAGE_CHARGE,
                    new BigDecimal("10"), "EUR", at("2024-05-06"), null, null, null, Map.of(),
                    RevenueSource.MANUAL));

            assertThatThrownBy(() -> aggregator.computeMetrics(MAY, CLUB))
                    .extracting(e -> ((RevenueException) e).code())
                    .isEqualTo(RevenueException.CALCULATION_ERROR);
        }
    }

    @Test
    @DisplayName("breakdown groups by tier, region and channel")
    void breakdown() {
        store.append(new RevenueEvent(UUID.randomUUID(), CLUB, RevenueEventType.SUBSCRIPTION_CREATED,
                new BigDecimal("100"), "USD", at("2024-05-02"), "s1", "c1", null,
                Map.of("tier", "gold", "region", "us-west"), RevenueSource.STRIPE));
        store.append(new RevenueEvent(UUID.randomUUID(), CLUB, RevenueEventType.ADD_ON_PURCHASE,
                new BigDecimal("20"), "USD", at("2024-05-03"), null, "c1", null,
                Map.of("tier", "gold"), RevenueSource.APPLE_PAY));
        store.append(event(CLUB, RevenueEventType.REFUND, "5", at("2024-05-04")));

        RevenueBreakdown breakdown = aggregator.computeBreakdown(store.snapshot(), CLUB, MAY.toDateRange());

        assertThat(breakdown.subscriptionRevenue()).isEqualByComparingTo("100");
        assertThat(breakdown.addOnRevenue()).isEqualByComparingTo("20");
        assertThat(breakdown.refundsAndCredits()).isEqualByComparingTo("5");
        assertThat(breakdown.revenueByTier()).containsOnlyKeys("gold", RevenueBreakdown.UNASSIGNED);
        assertThat(breakdown.revenueByTier().get("gold")).isEqualByComparingTo("120");
        assertThat(breakdown.revenueByTier().get(RevenueBreakdown.UNASSIGNED)).isEqualByComparingTo("-5");
        assertThat(breakdown.revenueByRegion().get("us-west")).isEqualByComparingTo("100");
        assertThat(breakdown.revenueByChannel()).containsOnlyKeys("stripe", "apple_pay");
    }

    @Test
    @DisplayName("breakdown rejects an inverted range")
    void breakdownRange() {
        DateRange inverted = DateRange.of(at("2024-05-10"), at("2024-05-01"));

        assertThatThrownBy(() -> aggregator.computeBreakdown(store.snapshot(), CLUB, inverted))
                .extracting(e -> ((RevenueException) e).code())
                .isEqualTo(RevenueException.INVALID_DATE_RANGE);
    }

    @Test
    @DisplayName("monthly series includes empty months")
    void monthlySeries() {
        store.append(event(CLUB, RevenueEventType.USAGE_CHARGE, "10", at("2024-02-10")));
        store.append(event(CLUB, RevenueEventType.USAGE_CHARGE, "30", at("2024-04-10")));

        List<PeriodTotals> series = aggregator.monthlySeries(store.snapshot(), CLUB,
                YearMonth.of(2024, 2), YearMonth.of(2024, 4));

        assertThat(series).extracting(p -> p.totals().net().intValue()).containsExactly(10, 0, 30);
        assertThat(series.get(1).totals().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("tenant revenue carries the tenant name")
    void tenantRevenue() {
        tenSubscriptionsAndARefund().forEach(store::append);

        TenantRevenue revenue = aggregator.computeTenantRevenue(store.snapshot(), MAY, CLUB, "Pebble Creek");

        assertThat(revenue.tenantName()).isEqualTo("Pebble Creek");
        assertThat(revenue.subscriptionRevenue()).isEqualByComparingTo("1000");
        assertThat(revenue.netRevenue()).isEqualByComparingTo("950");
    }
}
