package com.fairway.revenue.anomaly;

import static com.fairway.revenue.RevenueFixtures.CLUB;
import static com.fairway.revenue.RevenueFixtures.event;
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
import com.fairway.revenue.ledger.LedgerSnapshot;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AnomalyDetector")
class AnomalyDetectorTest {

    private static final LocalDate FIRST_DAY = LocalDate.of(2024, 5, 1);
    private static final DateRange MAY = DateRange.of(Instant.parse("2024-05-01T00:00:00Z"),
            Instant.parse("2024-06-01T00:00:00Z"));

    private final AnomalyDetector detector = new AnomalyDetector(RevenueFixtures.aggregator(
            RevenueFixtures.store(new MutableClock(Instant.parse("2024-06-01T00:00:00Z"))),
            RevenueFeatures.defaults()));

    /** One usage charge per day from {@link #FIRST_DAY}; a null amount leaves the day empty. */
    private static List<RevenueEvent> daily(List<String> amounts) {
        List<RevenueEvent> events = new ArrayList<>();
        for (int i = 0; i < amounts.size(); i++) {
            if (amounts.get(i) != null) {
                Instant at = FIRST_DAY.plusDays(i).atTime(12, 0).toInstant(ZoneOffset.UTC);
                events.add(event(CLUB, RevenueEventType.USAGE_CHARGE, amounts.get(i), at));
            }
        }
        return events;
    }

    /** 100, 101, 102 repeating: small noise that neither alternates nor strays two σ. */
    private static List<String> steady(int days) {
        List<String> amounts = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            amounts.add(String.valueOf(100 + i % 3));
        }
        return amounts;
    }

    private static LedgerSnapshot snapshot(List<RevenueEvent> events, String asOf) {
        return LedgerSnapshot.of(Instant.parse(asOf), events);
    }

    @Nested
    @DisplayName("statistical anomalies")
    class Statistical {

        @Test
        @DisplayName("steady revenue has no anomalies")
        void steadyRevenue() {
            List<RevenueAnomaly> anomalies = detector.detect(
                    snapshot(daily(steady(21)), "2024-05-22T06:00:00Z"), CLUB, MAY);

            assertThat(anomalies).isEmpty();
        }

        @Test
        @DisplayName("reports a collapse as a critical sudden drop with its causes")
        void suddenDrop() {
            List<String> amounts = steady(20);
            amounts.add("10");

            List<RevenueAnomaly> anomalies = detector.detect(
                    snapshot(daily(amounts), "2024-05-22T06:00:00Z"), CLUB, MAY);

            assertThat(anomalies).hasSize(1);
            RevenueAnomaly drop = anomalies.get(0);
            assertThat(drop.anomalyType()).isEqualTo(AnomalyType.SUDDEN_DROP);
            assertThat(drop.severity()).isEqualTo(AnomalySeverity.CRITICAL);
            assertThat(drop.day()).isEqualTo(LocalDate.of(2024, 5, 21));
            assertThat(drop.affectedRevenue()).isNegative();
            assertThat(drop.possibleCauses()).first().asString().startsWith("usage_charge down");
            assertThat(drop.recommendedActions()).isNotEmpty();
            assertThat(drop.detectedAt()).isEqualTo(Instant.parse("2024-05-22T06:00:00Z"));
        }

        @Test
        @DisplayName("an empty day after a full baseline is missing data, not a drop")
        void missingData() {
            List<String> amounts = steady(20);
            amounts.add(null);

            List<RevenueAnomaly> anomalies = detector.detect(
                    snapshot(daily(amounts), "2024-05-22T06:00:00Z"), CLUB, MAY);

            assertThat(anomalies).extracting(RevenueAnomaly::anomalyType)
                    .containsExactly(AnomalyType.MISSING_DATA);
        }

        @Test
        @DisplayName("any deviation from a zero-variance baseline is critical")
        void zeroVariance() {
            List<String> amounts = new ArrayList<>();
            for (int i = 0; i < 14; i++) {
                amounts.add("100");
            }
            amounts.add("150");

            List<RevenueAnomaly> anomalies = detector.detect(
                    snapshot(daily(amounts), "2024-05-16T06:00:00Z"), CLUB, MAY);

            assertThat(anomalies).hasSize(1);
            assertThat(anomalies.get(0).anomalyType()).isEqualTo(AnomalyType.SUDDEN_SPIKE);
            assertThat(anomalies.get(0).severity()).isEqualTo(AnomalySeverity.CRITICAL);
            assertThat(anomalies.get(0).zScore()).isNull();
        }

        @Test
        @DisplayName("reports a run of alternating days once")
        void unusualPattern() {
            List<String> amounts = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                amounts.add(i % 2 == 0 ? "100" : "120");
            }

            List<RevenueAnomaly> anomalies = detector.detect(
                    snapshot(daily(amounts), "2024-05-21T06:00:00Z"), CLUB, MAY);

            assertThat(anomalies).hasSize(1);
            assertThat(anomalies.get(0).anomalyType()).isEqualTo(AnomalyType.UNUSUAL_PATTERN);
            assertThat(anomalies.get(0).day()).isEqualTo(LocalDate.of(2024, 5, 8));
        }

        @Test
        @DisplayName("does not test days without seven days of baseline")
        void shortHistory() {
            List<String> amounts = List.of("100", "100", "100", "100", "5000");

            assertThat(detector.detect(snapshot(daily(amounts), "2024-05-06T06:00:00Z"), CLUB, MAY)).isEmpty();
        }

        @Test
        @DisplayName("only tests days inside the requested range")
        void rangeLimited() {
            List<String> amounts = steady(20);
            amounts.add("10");
            DateRange firstHalf = DateRange.of(Instant.parse("2024-05-01T00:00:00Z"),
                    Instant.parse("2024-05-16T00:00:00Z"));

            assertThat(detector.detect(snapshot(daily(amounts), "2024-05-22T06:00:00Z"), CLUB, firstHalf))
                    .isEmpty();
        }
    }

    @Nested
    @DisplayName("data inconsistency")
    class Inconsistency {

        private RevenueEvent withInvoice(RevenueEventType type, String amount, String invoice, String day) {
            return new RevenueEvent(UUID.randomUUID(), CLUB, type, new BigDecimal(amount), "USD",
                    Instant.parse(day + "T12:00:00Z"), null, "cust-1", invoice, Map.of(), RevenueSource.STRIPE);
        }

        @Test
        @DisplayName("flags reversals of invoices that were never charged")
        void orphanReversals() {
            List<RevenueEvent> events = List.of(
                    withInvoice(RevenueEventType.ONE_TIME_PAYMENT, "100", "inv-1", "2024-05-02"),
                    withInvoice(RevenueEventType.REFUND, "40", "inv-1", "2024-05-03"),
                    withInvoice(RevenueEventType.REFUND, "20", "inv-404", "2024-05-03"),
                    withInvoice(RevenueEventType.CHARGEBACK, "30", "inv-405", "2024-05-04"));

            List<RevenueAnomaly> anomalies = detector.detect(snapshot(events, "2024-05-05T06:00:00Z"), CLUB, MAY);

            assertThat(anomalies).extracting(RevenueAnomaly::anomalyType).containsOnly(AnomalyType.DATA_INCONSISTENCY);
            assertThat(anomalies).extracting(RevenueAnomaly::severity)
                    .containsExactly(AnomalySeverity.MEDIUM, AnomalySeverity.HIGH);
            assertThat(anomalies.get(0).affectedRevenue()).isEqualByComparingTo("-20");
            assertThat(anomalies.get(0).description()).contains("inv-404");
        }
    }

    @Test
    @DisplayName("rejects an inverted range")
    void invertedRange() {
        DateRange inverted = DateRange.of(MAY.end(), MAY.start());

        assertThatThrownBy(() -> detector.detect(LedgerSnapshot.of(MAY.end(), List.of()), CLUB, inverted))
                .extracting(e -> ((RevenueException) e).code())
                .isEqualTo(RevenueException.INVALID_DATE_RANGE);
    }

    @Test
    @DisplayName("severity bands follow |z|")
    void severityBands() {
        assertThat(AnomalySeverity.forZScore(new BigDecimal("1.99"))).isEmpty();
        assertThat(AnomalySeverity.forZScore(new BigDecimal("-2"))).contains(AnomalySeverity.LOW);
        assertThat(AnomalySeverity.forZScore(new BigDecimal("3.5"))).contains(AnomalySeverity.MEDIUM);
        assertThat(AnomalySeverity.forZScore(new BigDecimal("4"))).contains(AnomalySeverity.HIGH);
        assertThat(AnomalySeverity.forZScore(new BigDecimal("-7"))).contains(AnomalySeverity.CRITICAL);
    }
}
