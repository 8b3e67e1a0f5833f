package com.fairway.revenue.forecast;

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
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Projects monthly net revenue forward.
 *
 * <p>History is the trailing run of complete calendar months, starting no earlier than the first
 * month with events and capped at {@code historyMonths}. A weighted least-squares line is fitted
 * with weights {@code 1..n} so recent months count more. With σ the sample standard deviation of
 * month-over-month deltas:
 * <ul>
 *   <li>scenario prediction = trend + multiplier × σ, floored at zero</li>
 *   <li>interval half-width = 1.96 × σ × √(h × (1 + 1/n))</li>
 *   <li>confidence = min(0.95, 0.5 + 0.05n) / (1 + CV) × 0.95^(h−1)</li>
 * </ul>
 * where h is the horizon in months and CV is σ over the mean absolute monthly net.
 */
public class ForecastEngine {

    private static final Logger log = LoggerFactory.getLogger(ForecastEngine.class);

    public static final int MIN_HISTORY_MONTHS = 3;
    public static final int DEFAULT_HISTORY_MONTHS = 12;
    public static final int MAX_HORIZON_MONTHS = 24;
    public static final int SEASONALITY_MIN_MONTHS = 12;

    private static final BigDecimal Z_95 = new BigDecimal("1.96");
    private static final BigDecimal DECAY = new BigDecimal("0.95");
    private static final BigDecimal MAX_BASE = new BigDecimal("0.95");
    private static final BigDecimal BASE_FLOOR = new BigDecimal("0.5");
    private static final BigDecimal PER_SAMPLE = new BigDecimal("0.05");

    private final MetricsAggregator aggregator;
    private final int historyMonths;

    public ForecastEngine(MetricsAggregator aggregator) {
        this(aggregator, DEFAULT_HISTORY_MONTHS);
    }

    public ForecastEngine(MetricsAggregator aggregator, int historyMonths) {
        if (historyMonths < MIN_HISTORY_MONTHS) {
            throw new IllegalArgumentException("historyMonths must be at least " + MIN_HISTORY_MONTHS);
        }
        this.aggregator = aggregator;
        this.historyMonths = historyMonths;
    }

    /**
     * One forecast per future month per scenario, ordered by month then scenario.
     *
     * @param monthCount number of months to predict, 1..24; month 1 is the current calendar month
     * @param scenarios  scenarios to produce; all three when empty
     * @throws RevenueException INVALID_REQUEST for a bad month count, FORECAST_FAILED with fewer than
     *                          three months of history
     */
    public List<RevenueForecast> forecast(LedgerSnapshot snapshot, String tenantId, int monthCount,
                                          Set<ForecastScenario> scenarios) {
        if (monthCount < 1 || monthCount > MAX_HORIZON_MONTHS) {
            throw RevenueException.invalidRequest("monthCount must be between 1 and " + MAX_HORIZON_MONTHS);
        }
        Set<ForecastScenario> requested = scenarios == null || scenarios.isEmpty()
                ? EnumSet.allOf(ForecastScenario.class)
                : EnumSet.copyOf(scenarios);

        Instant asOf = snapshot.asOf();
        YearMonth current = YearMonth.from(asOf.atZone(ZoneOffset.UTC));
        YearMonth lastComplete = current.minusMonths(1);
        YearMonth firstWithEvents = snapshot.firstEventAt(tenantId)
                .map(t -> YearMonth.from(t.atZone(ZoneOffset.UTC)))
                .orElseThrow(() -> RevenueException.forecastFailed("no revenue history"));
        YearMonth from = firstWithEvents.isAfter(lastComplete.minusMonths(historyMonths - 1L))
                ? firstWithEvents
                : lastComplete.minusMonths(historyMonths - 1L);
        if (from.isAfter(lastComplete)) {
            throw RevenueException.forecastFailed("no complete month of history yet");
        }

        List<PeriodTotals> series = aggregator.monthlySeries(snapshot, tenantId, from, lastComplete);
        if (series.size() < MIN_HISTORY_MONTHS) {
            throw RevenueException.forecastFailed("needs at least " + MIN_HISTORY_MONTHS
                    + " complete months of history, found " + series.size());
        }

        List<BigDecimal> values = new ArrayList<>(series.size());
        for (PeriodTotals month : series) {
            values.add(month.totals().net());
        }
        Fit fit = fit(values);

        List<RevenueForecast> forecasts = new ArrayList<>();
        for (int h = 1; h <= monthCount; h++) {
            YearMonth month = lastComplete.plusMonths(h);
            BigDecimal trend = fit.valueAt(values.size() + h);
            BigDecimal halfWidth = Z_95.multiply(fit.sigma())
                    .multiply(BigDecimal.valueOf(h).multiply(BigDecimal.ONE.add(
                            BigDecimal.ONE.divide(BigDecimal.valueOf(values.size()), RevenueMath.MC)))
                            .sqrt(RevenueMath.MC));
            BigDecimal confidence = RevenueMath.rate(RevenueMath.clamp(
                    fit.baseConfidence().multiply(DECAY.pow(h - 1)), BigDecimal.ZERO, BigDecimal.ONE));
            List<ForecastFactor> factors = factors(fit, values, series, month);

            for (ForecastScenario scenario : requested) {
                BigDecimal predicted = trend.add(scenario.volatilityMultiplier().multiply(fit.sigma()))
                        .max(BigDecimal.ZERO);
                ConfidenceInterval interval = new ConfidenceInterval(
                        RevenueMath.money(predicted.subtract(halfWidth).max(BigDecimal.ZERO)),
                        RevenueMath.money(predicted.add(halfWidth)),
                        confidence);
                forecasts.add(new RevenueForecast(
                        forecastId(tenantId, month, scenario, snapshot.version(tenantId)),
                        tenantId, month, h, scenario, RevenueMath.money(predicted), interval, factors, asOf));
            }
        }
        log.debug("Forecast {} months for {} from {} months of history (slope {}, sigma {})",
                monthCount, tenantId == null ? "platform" : tenantId, values.size(),
                fit.slope(), fit.sigma());
        return forecasts;
    }

    /** Weighted least squares over x = 1..n with weights w = x. */
    static Fit fit(List<BigDecimal> values) {
        int n = values.size();
        BigDecimal sw = BigDecimal.ZERO;
        BigDecimal swx = BigDecimal.ZERO;
        BigDecimal swy = BigDecimal.ZERO;
        BigDecimal swxx = BigDecimal.ZERO;
        BigDecimal swxy = BigDecimal.ZERO;
        for (int i = 0; i < n; i++) {
            BigDecimal x = BigDecimal.valueOf(i + 1L);
            BigDecimal w = x;
            BigDecimal y = values.get(i);
            sw = sw.add(w);
            swx = swx.add(w.multiply(x));
            swy = swy.add(w.multiply(y));
            swxx = swxx.add(w.multiply(x).multiply(x));
            swxy = swxy.add(w.multiply(x).multiply(y));
        }
        BigDecimal denominator = sw.multiply(swxx).subtract(swx.multiply(swx));
        BigDecimal slope = sw.multiply(swxy).subtract(swx.multiply(swy)).divide(denominator, RevenueMath.MC);
        BigDecimal intercept = swy.subtract(slope.multiply(swx)).divide(sw, RevenueMath.MC);

        List<BigDecimal> deltas = new ArrayList<>(n - 1);
        for (int i = 1; i < n; i++) {
            deltas.add(values.get(i).subtract(values.get(i - 1)));
        }
        BigDecimal sigma = RevenueMath.sampleStdDev(deltas);

        BigDecimal meanAbs = RevenueMath.mean(values).abs();
        BigDecimal cv;
        if (meanAbs.signum() == 0) {
            cv = sigma.signum() == 0 ? BigDecimal.ZERO : BigDecimal.ONE;
        } else {
            cv = sigma.divide(meanAbs, RevenueMath.MC);
        }
        BigDecimal base = BASE_FLOOR.add(PER_SAMPLE.multiply(BigDecimal.valueOf(n))).min(MAX_BASE)
                .divide(BigDecimal.ONE.add(cv), RevenueMath.MC);
        return new Fit(slope, intercept, sigma, cv, meanAbs, base);
    }

    private List<ForecastFactor> factors(Fit fit, List<BigDecimal> values, List<PeriodTotals> series,
                                         YearMonth target) {
        List<ForecastFactor> factors = new ArrayList<>(3);
        BigDecimal confidence = RevenueMath.rate(fit.baseConfidence());
        BigDecimal trendImpact = RevenueMath.rate(relative(fit.slope(), fit.meanAbs()));
        factors.add(new ForecastFactor("growth_trend", trendImpact, confidence,
                "Fitted trend moves net revenue by " + RevenueMath.money(fit.slope()) + " per month"));
        factors.add(new ForecastFactor("volatility", RevenueMath.rate(fit.cv().negate()), confidence,
                "Month-over-month changes vary by " + RevenueMath.money(fit.sigma())));

        if (values.size() >= SEASONALITY_MIN_MONTHS) {
            BigDecimal sameMonth = null;
            for (PeriodTotals month : series) {
                if (month.period().start().atZone(ZoneOffset.UTC).getMonth() == target.getMonth()) {
                    sameMonth = month.totals().net();
                }
            }
            if (sameMonth != null) {
                BigDecimal mean = RevenueMath.mean(values);
                factors.add(new ForecastFactor("seasonality",
                        RevenueMath.rate(relative(sameMonth.subtract(mean), fit.meanAbs())), confidence,
                        target.getMonth() + " historically deviates from the monthly mean by "
                                + RevenueMath.money(sameMonth.subtract(mean))));
            }
        }
        return factors;
    }

    private static BigDecimal relative(BigDecimal value, BigDecimal scale) {
        return scale.signum() == 0 ? BigDecimal.ZERO : value.divide(scale, RevenueMath.MC);
    }

    private static UUID forecastId(String tenantId, YearMonth month, ForecastScenario scenario, long version) {
        String key = "forecast:" + tenantId + ":" + month + ":" + scenario.value() + ":" + version;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Fitted line and series statistics.
     */
    record Fit(BigDecimal slope, BigDecimal intercept, BigDecimal sigma, BigDecimal cv,
               BigDecimal meanAbs, BigDecimal baseConfidence) {

        BigDecimal valueAt(int x) {
            return intercept.add(slope.multiply(BigDecimal.valueOf(x)));
        }
    }
}
