package com.fairway.revenue.growth;

import com.fairway.eventmodel.RevenueCategory;
import com.fairway.revenue.RevenueException;
import com.fairway.revenue.RevenueFeatures;
import com.fairway.revenue.RevenueMath;
import com.fairway.revenue.ledger.LedgerSnapshot;
import com.fairway.revenue.metrics.MetricsAggregator;
import com.fairway.revenue.metrics.PeriodTotals;
import com.fairway.revenue.metrics.RevenueTotals;
import com.fairway.revenue.period.Granularity;
import com.fairway.revenue.period.RevenuePeriod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Quarter, year and month growth analysis.
 *
 * <p>Growth between two buckets is {@code (net − previousNet) / |previousNet|}. A previous net of
 * zero leaves the rate undefined; undefined rates are reported as zero and left out of trend
 * classification.
 */
public class GrowthAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(GrowthAnalyzer.class);

    /** Number of monthly growth rates used for the trend. */
    public static final int TREND_SAMPLES = 3;

    public static final BigDecimal INDUSTRY_AVERAGE_QUARTERLY_GROWTH = new BigDecimal("0.05");
    public static final String BENCHMARK_NAME = "Golf course SaaS quarterly revenue growth";
    private static final BigDecimal AVERAGE_BAND = new BigDecimal("0.01");
    private static final BigDecimal PERCENTILE_SCALE = BigDecimal.valueOf(500);
    private static final BigDecimal MIN_PERCENTILE_OFFSET = BigDecimal.valueOf(-49);
    private static final BigDecimal MAX_PERCENTILE_OFFSET = BigDecimal.valueOf(49);

    private static final List<RevenueCategory> DRIVER_CATEGORIES = List.of(
            RevenueCategory.RECURRING, RevenueCategory.USAGE, RevenueCategory.ONE_TIME, RevenueCategory.REFUND);

    private final MetricsAggregator aggregator;
    private final RevenueFeatures features;

    public GrowthAnalyzer(MetricsAggregator aggregator, RevenueFeatures features) {
        this.aggregator = aggregator;
        this.features = features;
    }

    /**
     * Growth as of the snapshot time.
     *
     * @throws RevenueException INSUFFICIENT_DATA when the tenant has no events
     */
    public RevenueGrowthAnalysis analyze(LedgerSnapshot snapshot, String tenantId) {
        Instant asOf = snapshot.asOf();
        if (snapshot.firstEventAt(tenantId).isEmpty()) {
            throw RevenueException.insufficientData("no revenue events for "
                    + (tenantId == null ? "platform" : "tenant " + tenantId));
        }

        RevenuePeriod lastQuarter = RevenuePeriod.containing(Granularity.QUARTERLY, asOf).previous();
        RevenueTotals quarter = totals(snapshot, tenantId, lastQuarter);
        RevenueTotals previousQuarter = totals(snapshot, tenantId, lastQuarter.previous());
        RevenueTotals yearEarlier = totals(snapshot, tenantId, lastQuarter.yearEarlier());
        BigDecimal qoq = growth(quarter.net(), previousQuarter.net());
        BigDecimal yoy = growth(quarter.net(), yearEarlier.net());

        YearMonth lastMonth = YearMonth.from(asOf.atZone(ZoneOffset.UTC)).minusMonths(1);
        List<PeriodTotals> months = aggregator.monthlySeries(snapshot, tenantId,
                lastMonth.minusMonths(TREND_SAMPLES), lastMonth);
        List<BigDecimal> monthlyRates = definedRates(months, RevenueTotals::net);
        BigDecimal current = monthlyRates.isEmpty()
                ? RevenueMath.rate(BigDecimal.ZERO)
                : monthlyRates.get(monthlyRates.size() - 1);

        List<GrowthDriver> drivers = drivers(quarter, previousQuarter, months);
        BenchmarkComparison benchmark = features.benchmarking() ? benchmark(qoq) : null;
        GrowthTrend trend = classify(monthlyRates);

        log.debug("Growth for {}: qoq {}, yoy {}, trend {}", tenantId == null ? "platform" : tenantId,
                qoq, yoy, trend);
        return new RevenueGrowthAnalysis(tenantId, asOf, current, qoq, yoy, trend, drivers,
                project(monthlyRates), benchmark, monthlyRates);
    }

    /**
     * Compares two complete, non-overlapping calendar quarters or years.
     *
     * @throws RevenueException INVALID_PERIOD when the periods are not comparable
     */
    public PeriodComparison compare(LedgerSnapshot snapshot, String tenantId, RevenuePeriod current,
                                    RevenuePeriod previous) {
        if (current.granularity() != previous.granularity()) {
            throw RevenueException.invalidPeriod("cannot compare " + current.granularity().value()
                    + " with " + previous.granularity().value());
        }
        if (current.granularity() != Granularity.QUARTERLY && current.granularity() != Granularity.YEARLY) {
            throw RevenueException.invalidPeriod("only quarterly or yearly periods can be compared");
        }
        if (!current.isCalendarAligned() || !previous.isCalendarAligned()) {
            throw RevenueException.invalidPeriod("compared periods must be calendar aligned");
        }
        if (current.overlaps(previous)) {
            throw RevenueException.invalidPeriod(current.label() + " overlaps " + previous.label());
        }
        Instant asOf = snapshot.asOf();
        if (!current.isCompleteAt(asOf) || !previous.isCompleteAt(asOf)) {
            throw RevenueException.invalidPeriod("compared periods must be complete at " + asOf);
        }

        RevenueTotals now = totals(snapshot, tenantId, current);
        RevenueTotals before = totals(snapshot, tenantId, previous);
        RevenueTotals.requireSameCurrency(now.currency(), before.currency());
        boolean defined = before.net().signum() != 0;
        return new PeriodComparison(tenantId, current, previous,
                RevenueMath.money(now.net()), RevenueMath.money(before.net()),
                growth(now.net(), before.net()), defined, drivers(now, before, List.of()));
    }

    /**
     * Trend of a series of growth rates, oldest first. Volatile when the sign flips more than once,
     * then accelerating when strictly increasing, declining when strictly decreasing, otherwise
     * steady. Fewer than two rates are steady.
     */
    public static GrowthTrend classify(List<BigDecimal> rates) {
        if (rates.size() < 2) {
            return GrowthTrend.STEADY;
        }
        int signChanges = 0;
        int previousSign = 0;
        for (BigDecimal rate : rates) {
            int sign = rate.signum();
            if (sign != 0) {
                if (previousSign != 0 && sign != previousSign) {
                    signChanges++;
                }
                previousSign = sign;
            }
        }
        if (signChanges > 1) {
            return GrowthTrend.VOLATILE;
        }
        boolean increasing = true;
        boolean decreasing = true;
        for (int i = 1; i < rates.size(); i++) {
            int cmp = rates.get(i).compareTo(rates.get(i - 1));
            increasing &= cmp > 0;
            decreasing &= cmp < 0;
        }
        if (increasing) {
            return GrowthTrend.ACCELERATING;
        }
        if (decreasing) {
            return GrowthTrend.DECLINING;
        }
        return GrowthTrend.STEADY;
    }

    /**
     * Percentile {@code clamp(50 + round((growth − average) × 500), 1, 99)}; within one point of the
     * average counts as average.
     */
    static BenchmarkComparison benchmark(BigDecimal quarterlyGrowth) {
        BigDecimal difference = quarterlyGrowth.subtract(INDUSTRY_AVERAGE_QUARTERLY_GROWTH);
        BigDecimal offset = difference.multiply(PERCENTILE_SCALE).setScale(0, RevenueMath.ROUNDING)
                .max(MIN_PERCENTILE_OFFSET).min(MAX_PERCENTILE_OFFSET);
        int percentile = 50 + offset.intValueExact();
        ComparisonResult result;
        if (difference.abs().compareTo(AVERAGE_BAND) <= 0) {
            result = ComparisonResult.AVERAGE;
        } else if (difference.signum() > 0) {
            result = ComparisonResult.ABOVE_AVERAGE;
        } else {
            result = ComparisonResult.BELOW_AVERAGE;
        }
        return new BenchmarkComparison(INDUSTRY_AVERAGE_QUARTERLY_GROWTH, percentile, result, BENCHMARK_NAME);
    }

    /** Last rate plus the average change between consecutive rates. */
    static BigDecimal project(List<BigDecimal> rates) {
        if (rates.isEmpty()) {
            return RevenueMath.rate(BigDecimal.ZERO);
        }
        BigDecimal last = rates.get(rates.size() - 1);
        if (rates.size() < 2) {
            return RevenueMath.rate(last);
        }
        BigDecimal averageStep = last.subtract(rates.get(0))
                .divide(BigDecimal.valueOf(rates.size() - 1L), RevenueMath.MC);
        return RevenueMath.rate(last.add(averageStep));
    }

    private List<GrowthDriver> drivers(RevenueTotals now, RevenueTotals before, List<PeriodTotals> months) {
        BigDecimal base = before.net().abs();
        List<GrowthDriver> drivers = new ArrayList<>(DRIVER_CATEGORIES.size());
        for (RevenueCategory category : DRIVER_CATEGORIES) {
            // refunds reduce net, so their growth counts against it
            int sign = category == RevenueCategory.REFUND ? -1 : 1;
            BigDecimal change = now.forCategory(category).subtract(before.forCategory(category))
                    .multiply(BigDecimal.valueOf(sign));
            BigDecimal contribution = RevenueMath.ratio(change, base);
            GrowthTrend trend = classify(definedRates(months, totals -> totals.forCategory(category)));
            String name = driverName(category);
            drivers.add(new GrowthDriver(name, contribution, trend,
                    name + " moved net revenue by " + RevenueMath.money(change) + " against the previous period"));
        }
        drivers.sort(Comparator.comparing((GrowthDriver d) -> d.contribution().abs()).reversed()
                .thenComparing(GrowthDriver::name));
        return drivers;
    }

    private static String driverName(RevenueCategory category) {
        return switch (category) {
            case RECURRING -> "recurring";
            case USAGE -> "usage";
            case ONE_TIME -> "one_time";
            case REFUND -> "refunds";
            case LIFECYCLE -> "lifecycle";
        };
    }

    private static RevenueTotals totals(LedgerSnapshot snapshot, String tenantId, RevenuePeriod period) {
        return RevenueTotals.of(snapshot.query(tenantId, period.toDateRange()));
    }

    private static List<BigDecimal> definedRates(List<PeriodTotals> series,
                                                 Function<RevenueTotals, BigDecimal> value) {
        List<BigDecimal> rates = new ArrayList<>();
        for (int i = 1; i < series.size(); i++) {
            BigDecimal previous = value.apply(series.get(i - 1).totals());
            if (previous.signum() != 0) {
                rates.add(growth(value.apply(series.get(i).totals()), previous));
            }
        }
        return rates;
    }

    private static BigDecimal growth(BigDecimal current, BigDecimal previous) {
        return RevenueMath.ratio(current.subtract(previous), previous.abs());
    }
}
