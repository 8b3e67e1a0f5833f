package com.fairway.revenue.anomaly;

import com.fairway.common.FairwayException;
import com.fairway.eventmodel.DateRange;
import com.fairway.eventmodel.Polarity;
import com.fairway.eventmodel.RevenueCategory;
import com.fairway.eventmodel.RevenueEvent;
import com.fairway.eventmodel.RevenueEventType;
import com.fairway.revenue.RevenueException;
import com.fairway.revenue.RevenueMath;
import com.fairway.revenue.ledger.LedgerSnapshot;
import com.fairway.revenue.metrics.MetricsAggregator;
import com.fairway.revenue.metrics.PeriodTotals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Finds anomalies in daily net revenue.
 *
 * <p>Each complete UTC day in the requested range is compared against a rolling baseline: the mean
 * and sample standard deviation of up to {@code baselineDays} preceding days, never reaching back
 * before the first day with events. Days with fewer than {@value #MIN_BASELINE_DAYS} baseline days
 * are not tested. The day under test is never part of its own baseline.
 *
 * <p>Per day at most one statistical anomaly is reported, in this order of precedence: missing
 * data (an empty day whose whole baseline had events), sudden drop or spike (|z| ≥ 2, or any
 * deviation from a zero-variance baseline), unusual pattern (the last six day-over-day deltas
 * alternate in sign and each is at least one σ). A pattern is reported only on the first day of a
 * run of matching days. Refunds and chargebacks referencing an invoice that was never charged are
 * reported as data inconsistencies independently.
 */
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    public static final int DEFAULT_BASELINE_DAYS = 14;
    public static final int MIN_BASELINE_DAYS = 7;
    public static final int PATTERN_DELTAS = 6;
    private static final int MAX_CAUSES = 3;

    private final MetricsAggregator aggregator;
    private final int baselineDays;

    public AnomalyDetector(MetricsAggregator aggregator) {
        this(aggregator, DEFAULT_BASELINE_DAYS);
    }

    public AnomalyDetector(MetricsAggregator aggregator, int baselineDays) {
        if (baselineDays < MIN_BASELINE_DAYS) {
            throw new IllegalArgumentException("baselineDays must be at least " + MIN_BASELINE_DAYS);
        }
        this.aggregator = aggregator;
        this.baselineDays = baselineDays;
    }

    /**
     * Anomalies in {@code range}, ordered by day then kind.
     *
     * @throws RevenueException INVALID_DATE_RANGE for an inverted range, ANOMALY_DETECTION_FAILED
     *                          when the computation breaks unexpectedly
     */
    public List<RevenueAnomaly> detect(LedgerSnapshot snapshot, String tenantId, DateRange range) {
        if (!range.isValid()) {
            throw RevenueException.invalidDateRange(range);
        }
        try {
            List<RevenueAnomaly> anomalies = new ArrayList<>();
            anomalies.addAll(statistical(snapshot, tenantId, range));
            anomalies.addAll(inconsistencies(snapshot, tenantId, range));
            anomalies.sort(Comparator.comparing(RevenueAnomaly::day)
                    .thenComparing(RevenueAnomaly::anomalyType)
                    .thenComparing(RevenueAnomaly::id));
            log.debug("Detected {} anomalies for {} in [{}, {})", anomalies.size(),
                    tenantId == null ? "platform" : tenantId, range.start(), range.end());
            return anomalies;
        } catch (FairwayException e) {
            throw e;
        } catch (RuntimeException e) {
            throw RevenueException.anomalyDetectionFailed(
                    "anomaly detection failed for " + (tenantId == null ? "platform" : tenantId), e);
        }
    }

    private List<RevenueAnomaly> statistical(LedgerSnapshot snapshot, String tenantId, DateRange range) {
        Optional<Instant> firstEvent = snapshot.firstEventAt(tenantId);
        if (firstEvent.isEmpty() || range.isEmpty()) {
            return List.of();
        }
        LocalDate firstEventDay = LocalDate.ofInstant(firstEvent.get(), ZoneOffset.UTC);
        LocalDate lastCompleteDay = LocalDate.ofInstant(snapshot.asOf(), ZoneOffset.UTC).minusDays(1);
        LocalDate from = LocalDate.ofInstant(range.start(), ZoneOffset.UTC);
        LocalDate to = LocalDate.ofInstant(range.end().minusNanos(1), ZoneOffset.UTC);
        LocalDate earliestTestable = firstEventDay.plusDays(MIN_BASELINE_DAYS);
        if (from.isBefore(earliestTestable)) {
            from = earliestTestable;
        }
        if (to.isAfter(lastCompleteDay)) {
            to = lastCompleteDay;
        }
        if (from.isAfter(to)) {
            return List.of();
        }

        LocalDate seriesStart = from.minusDays(baselineDays);
        List<PeriodTotals> series = aggregator.dailySeries(snapshot, tenantId, seriesStart, to);
        int firstEventIndex = (int) Math.max(0, ChronoUnit.DAYS.between(seriesStart, firstEventDay));
        long version = snapshot.version(tenantId);

        List<RevenueAnomaly> anomalies = new ArrayList<>();
        boolean previousDayMatchedPattern = false;
        for (int i = baselineDays; i < series.size(); i++) {
            LocalDate day = seriesStart.plusDays(i);
            List<PeriodTotals> baseline = series.subList(Math.max(i - baselineDays, firstEventIndex), i);
            if (baseline.size() < MIN_BASELINE_DAYS) {
                previousDayMatchedPattern = false;
                continue;
            }
            List<BigDecimal> baselineNets = nets(baseline);
            BigDecimal mean = RevenueMath.mean(baselineNets);
            BigDecimal sigma = RevenueMath.sampleStdDev(baselineNets);
            PeriodTotals bucket = series.get(i);
            BigDecimal deviation = bucket.totals().net().subtract(mean);
            BigDecimal z = sigma.signum() == 0 ? null : RevenueMath.rate(deviation.divide(sigma, RevenueMath.MC));
            Optional<AnomalySeverity> severity = severityFor(deviation, z);

            boolean matchesPattern = sigma.signum() > 0
                    && alternates(series, i, sigma, firstEventIndex);

            AnomalyType type = null;
            AnomalySeverity band = null;
            if (bucket.totals().isEmpty() && baseline.stream().noneMatch(b -> b.totals().isEmpty())) {
                type = AnomalyType.MISSING_DATA;
                band = severity.orElse(AnomalySeverity.LOW);
            } else if (severity.isPresent()) {
                type = deviation.signum() < 0 ? AnomalyType.SUDDEN_DROP : AnomalyType.SUDDEN_SPIKE;
                band = severity.get();
            } else if (matchesPattern && !previousDayMatchedPattern) {
                type = AnomalyType.UNUSUAL_PATTERN;
                band = AnomalySeverity.MEDIUM;
            }
            previousDayMatchedPattern = matchesPattern;

            if (type != null) {
                anomalies.add(new RevenueAnomaly(
                        anomalyId(tenantId, day.toString(), type, version),
                        snapshot.asOf(),
                        type,
                        band,
                        describe(type, day, bucket.totals().net(), mean, z),
                        RevenueMath.money(deviation),
                        causes(type, bucket, baseline),
                        recommendedActions(type),
                        tenantId,
                        day,
                        z));
            }
        }
        return anomalies;
    }

    /**
     * Refunds and chargebacks whose invoice has no positive charge anywhere in the tenant's
     * visible ledger.
     */
    private List<RevenueAnomaly> inconsistencies(LedgerSnapshot snapshot, String tenantId, DateRange range) {
        Set<String> chargedInvoices = new HashSet<>();
        for (RevenueEvent event : snapshot.events(tenantId)) {
            if (event.invoiceId() != null && event.type().polarity() == Polarity.POSITIVE) {
                chargedInvoices.add(invoiceKey(event));
            }
        }
        List<RevenueAnomaly> anomalies = new ArrayList<>();
        for (RevenueEvent event : snapshot.query(tenantId, range)) {
            boolean reversal = event.type() == RevenueEventType.REFUND
                    || event.type() == RevenueEventType.CHARGEBACK;
            if (!reversal || event.invoiceId() == null || chargedInvoices.contains(invoiceKey(event))) {
                continue;
            }
            AnomalySeverity severity = event.type() == RevenueEventType.CHARGEBACK
                    ? AnomalySeverity.HIGH
                    : AnomalySeverity.MEDIUM;
            anomalies.add(new RevenueAnomaly(
                    anomalyId(tenantId, event.id().toString(), AnomalyType.DATA_INCONSISTENCY, 0),
                    snapshot.asOf(),
                    AnomalyType.DATA_INCONSISTENCY,
                    severity,
                    event.type().value() + " " + event.id() + " references invoice " + event.invoiceId()
                            + " which was never charged",
                    RevenueMath.money(event.contribution()),
                    List.of(event.type().value() + " without a matching charge"),
                    recommendedActions(AnomalyType.DATA_INCONSISTENCY),
                    tenantId,
                    LocalDate.ofInstant(event.timestamp(), ZoneOffset.UTC),
                    null));
        }
        return anomalies;
    }

    private static Optional<AnomalySeverity> severityFor(BigDecimal deviation, BigDecimal z) {
        if (z == null) {
            return deviation.signum() == 0 ? Optional.empty() : Optional.of(AnomalySeverity.CRITICAL);
        }
        return AnomalySeverity.forZScore(z);
    }

    private static boolean alternates(List<PeriodTotals> series, int index, BigDecimal sigma, int firstEventIndex) {
        if (index - PATTERN_DELTAS < firstEventIndex) {
            return false;
        }
        int previousSign = 0;
        for (int k = index - PATTERN_DELTAS + 1; k <= index; k++) {
            BigDecimal delta = series.get(k).totals().net().subtract(series.get(k - 1).totals().net());
            int sign = delta.signum();
            if (sign == 0 || delta.abs().compareTo(sigma) < 0 || sign == previousSign) {
                return false;
            }
            previousSign = sign;
        }
        return true;
    }

    private static List<String> causes(AnomalyType type, PeriodTotals bucket, List<PeriodTotals> baseline) {
        List<TypeMovement> movements = new ArrayList<>();
        for (RevenueEventType eventType : RevenueEventType.values()) {
            if (eventType.category() == RevenueCategory.LIFECYCLE) {
                continue;
            }
            List<BigDecimal> history = new ArrayList<>(baseline.size());
            for (PeriodTotals day : baseline) {
                history.add(day.totals().forType(eventType));
            }
            BigDecimal delta = bucket.totals().forType(eventType).subtract(RevenueMath.mean(history));
            if (delta.signum() != 0) {
                movements.add(new TypeMovement(eventType, delta));
            }
        }
        movements.sort(Comparator.comparing((TypeMovement m) -> m.delta().abs()).reversed()
                .thenComparing(TypeMovement::type));

        List<String> causes = new ArrayList<>(MAX_CAUSES + 1);
        if (type == AnomalyType.MISSING_DATA) {
            causes.add("no events were recorded for the day");
        }
        for (TypeMovement movement : movements.subList(0, Math.min(MAX_CAUSES, movements.size()))) {
            causes.add(movement.type().value() + (movement.delta().signum() > 0 ? " up " : " down ")
                    + RevenueMath.money(movement.delta().abs()) + " against baseline");
        }
        return causes;
    }

    static List<String> recommendedActions(AnomalyType type) {
        return switch (type) {
            case SUDDEN_DROP -> List.of(
                    "Check payment provider status and failed charges",
                    "Review cancellations and refunds recorded for the day");
            case SUDDEN_SPIKE -> List.of(
                    "Verify large or duplicated charges",
                    "Confirm the spike matches a known promotion or tournament");
            case UNUSUAL_PATTERN -> List.of("Review billing schedules for charges that oscillate day to day");
            case MISSING_DATA -> List.of(
                    "Check event ingestion from payment providers",
                    "Backfill the day if events were dropped");
            case DATA_INCONSISTENCY -> List.of(
                    "Locate the original charge for the invoice",
                    "Record a compensating event if the reversal is wrong");
        };
    }

    private static String describe(AnomalyType type, LocalDate day, BigDecimal net, BigDecimal mean, BigDecimal z) {
        String zText = z == null ? "zero-variance baseline" : "z = " + z;
        return switch (type) {
            case MISSING_DATA -> "No revenue events on " + day + " while every baseline day had events";
            case UNUSUAL_PATTERN -> "Net revenue alternated direction for " + PATTERN_DELTAS
                    + " consecutive days up to " + day;
            default -> "Net revenue on " + day + " was " + RevenueMath.money(net) + " against a baseline of "
                    + RevenueMath.money(mean) + " (" + zText + ")";
        };
    }

    private static List<BigDecimal> nets(List<PeriodTotals> buckets) {
        List<BigDecimal> values = new ArrayList<>(buckets.size());
        for (PeriodTotals bucket : buckets) {
            values.add(bucket.totals().net());
        }
        return values;
    }

    private static String invoiceKey(RevenueEvent event) {
        return event.tenantId() + "/" + event.invoiceId();
    }

    private static UUID anomalyId(String tenantId, String subject, AnomalyType type, long version) {
        String key = "anomaly:" + tenantId + ":" + subject + ":" + type.value() + ":" + version;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
    }

    private record TypeMovement(RevenueEventType type, BigDecimal delta) {
    }
}
