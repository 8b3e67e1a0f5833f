package com.fairway.revenue.forecast;

import static com.fairway.revenue.RevenueFixtures.CLUB;
import static com.fairway.revenue.RevenueFixtures.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fairway.eventmodel.RevenueEvent;
import com.fairway.eventmodel.RevenueEventType;
import com.fairway.revenue.MutableClock;
import com.fairway.revenue.RevenueException;
import com.fairway.revenue.RevenueFeatures;
import com.fairway.revenue.RevenueFixtures;
import com.fairway.revenue.ledger.LedgerSnapshot;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ForecastEngine")
class ForecastEngineTest {

    private static final Instant NOW = Instant.parse("2024-07-10T08:00:00Z");

    private final ForecastEngine engine = new ForecastEngine(RevenueFixtures.aggregator(
            RevenueFixtures.store(new MutableClock(NOW)), RevenueFeatures.defaults()));

    /** One usage charge per month, starting at {@code first}. */
    private static LedgerSnapshot history(YearMonth first, String... amounts) {
        List<RevenueEvent> events = new ArrayList<>();
        for (int i = 0; i < amounts.length; i++) {
            Instant at = first.plusMonths(i).atDay(10).atStartOfDay().toInstant(ZoneOffset.UTC);
            events.add(event(CLUB, RevenueEventType.USAGE_CHARGE, amounts[i], at));
        }
        return LedgerSnapshot.of(NOW, events);
    }

    private static LedgerSnapshot noisyHistory() {
        return history(YearMonth.of(2024, 1), "1000", "1150", "1080", "1300", "1250", "1420");
    }

    @Nested
    @DisplayName("trend")
    class Trend {

        @Test
        @DisplayName("extends a perfectly linear history exactly")
        void linear() {
            List<RevenueForecast> forecasts = engine.forecast(
                    history(YearMonth.of(2024, 1), "1000", "1100", "1200", "1300", "1400", "1500"),
                    CLUB, 2, Set.of(ForecastScenario.REALISTIC));

            assertThat(forecasts).hasSize(2);
            assertThat(forecasts.get(0).month()).isEqualTo(YearMonth.of(2024, 7));
            assertThat(forecasts.get(0).predictedRevenue()).isEqualByComparingTo("1600");
            assertThat(forecasts.get(1).predictedRevenue()).isEqualByComparingTo("1700");
            assertThat(forecasts.get(0).confidenceInterval().lowerBound()).isEqualByComparingTo("1600");
        }

        @Test
        @DisplayName("weights recent months more heavily")
        void weighting() {
            ForecastEngine.Fit fit = ForecastEngine.fit(List.of(
                    new BigDecimal("100"), new BigDecimal("100"), new BigDecimal("100"), new BigDecimal("400")));
            BigDecimal unweightedSlope = new BigDecimal("90");

            assertThat(fit.slope()).isGreaterThan(unweightedSlope);
        }

        @Test
        @DisplayName("floors predictions and lower bounds at zero")
        void floor() {
            List<RevenueForecast> forecasts = engine.forecast(
                    history(YearMonth.of(2024, 4), "3000", "2000", "1000"),
                    CLUB, 3, Set.of());

            assertThat(forecasts).allSatisfy(f -> {
                assertThat(f.predictedRevenue()).isGreaterThanOrEqualTo(BigDecimal.ZERO);
                assertThat(f.confidenceInterval().lowerBound()).isGreaterThanOrEqualTo(BigDecimal.ZERO);
            });
            assertThat(forecasts.get(forecasts.size() - 1).predictedRevenue()).isEqualByComparingTo("0");
        }
    }

    @Nested
    @DisplayName("scenarios and confidence")
    class ScenariosAndConfidence {

        @Test
        @DisplayName("confidence never increases with the horizon")
        void confidenceMonotonic() {
            List<RevenueForecast> forecasts = engine.forecast(noisyHistory(), CLUB, 12,
                    Set.of(ForecastScenario.REALISTIC));

            for (int i = 1; i < forecasts.size(); i++) {
                assertThat(forecasts.get(i).confidenceInterval().confidence())
                        .isLessThanOrEqualTo(forecasts.get(i - 1).confidenceInterval().confidence());
            }
            assertThat(forecasts.get(0).confidenceInterval().confidence())
                    .isBetween(BigDecimal.ZERO, BigDecimal.ONE);
        }

        @Test
        @DisplayName("intervals widen with the horizon")
        void intervalsWiden() {
            List<RevenueForecast> forecasts = engine.forecast(noisyHistory(), CLUB, 3,
                    Set.of(ForecastScenario.REALISTIC));

            BigDecimal first = width(forecasts.get(0));
            BigDecimal last = width(forecasts.get(2));
            assertThat(last).isGreaterThan(first);
        }

        @Test
        @DisplayName("orders scenarios conservative ≤ realistic ≤ optimistic")
        void scenarioOrder() {
            List<RevenueForecast> forecasts = engine.forecast(noisyHistory(), CLUB, 1, Set.of());

            assertThat(forecasts).extracting(RevenueForecast::scenario).containsExactly(
                    ForecastScenario.CONSERVATIVE, ForecastScenario.REALISTIC, ForecastScenario.OPTIMISTIC);
            assertThat(forecasts.get(0).predictedRevenue()).isLessThan(forecasts.get(1).predictedRevenue());
            assertThat(forecasts.get(1).predictedRevenue()).isLessThan(forecasts.get(2).predictedRevenue());
        }

        private BigDecimal width(RevenueForecast forecast) {
            return forecast.confidenceInterval().upperBound().subtract(forecast.confidenceInterval().lowerBound());
        }
    }

    @Nested
    @DisplayName("factors")
    class Factors {

        @Test
        @DisplayName("reports trend and volatility without seasonality for short histories")
        void shortHistory() {
            RevenueForecast forecast = engine.forecast(noisyHistory(), CLUB, 1, Set.of(ForecastScenario.REALISTIC))
                    .get(0);

            assertThat(forecast.factors()).extracting(ForecastFactor::name)
                    .containsExactly("growth_trend", "volatility");
        }

        @Test
        @DisplayName("adds seasonality with twelve months of history")
        void seasonality() {
            LedgerSnapshot snapshot = history(YearMonth.of(2023, 7), "900", "950", "1000", "980", "1020",
                    "1100", "1050", "1080", "1150", "1120", "1200", "1250");

            RevenueForecast forecast = engine.forecast(snapshot, CLUB, 1, Set.of(ForecastScenario.REALISTIC))
                    .get(0);

            assertThat(forecast.factors()).extracting(ForecastFactor::name).contains("seasonality");
        }

        @Test
        @DisplayName("finds the seasonal month whatever the default locale's digits")
        void seasonalityIgnoresDefaultLocale() {
            LedgerSnapshot snapshot = history(YearMonth.of(2023, 7), "900", "950", "1000", "980", "1020",
                    "1100", "1050", "1080", "1150", "1120", "1200", "1250");
            Locale original = Locale.getDefault();
            Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));
            try {
                RevenueForecast forecast = engine.forecast(snapshot, CLUB, 1, Set.of(ForecastScenario.REALISTIC))
                        .get(0);

                assertThat(forecast.factors()).extracting(ForecastFactor::name).contains("seasonality");
            } finally {
                Locale.setDefault(original);
            }
        }
    }

    @Nested
    @DisplayName("preconditions")
    class Preconditions {

        @Test
        @DisplayName("fails with fewer than three complete months")
        void tooShort() {
            assertThatThrownBy(() -> engine.forecast(history(YearMonth.of(2024, 5), "100", "200"), CLUB, 1, Set.of()))
                    .extracting(e -> ((RevenueException) e).code())
                    .isEqualTo(RevenueException.FORECAST_FAILED);
        }

        @Test
        @DisplayName("fails without any history")
        void noHistory() {
            assertThatThrownBy(() -> engine.forecast(LedgerSnapshot.of(NOW, List.of()), CLUB, 1, Set.of()))
                    .extracting(e -> ((RevenueException) e).code())
                    .isEqualTo(RevenueException.FORECAST_FAILED);
        }

        @Test
        @DisplayName("rejects a month count outside 1..24")
        void monthCount() {
            assertThatThrownBy(() -> engine.forecast(noisyHistory(), CLUB, 0, Set.of()))
                    .extracting(e -> ((RevenueException) e).code())
                    .isEqualTo(RevenueException.INVALID_REQUEST);
            assertThatThrownBy(() -> engine.forecast(noisyHistory(), CLUB, 25, Set.of()))
                    .extracting(e -> ((RevenueException) e).code())
                    .isEqualTo(RevenueException.INVALID_REQUEST);
        }
    }

    @Test
    @DisplayName("is deterministic for the same snapshot")
    void deterministic() {
        LedgerSnapshot snapshot = noisyHistory();

        assertThat(engine.forecast(snapshot, CLUB, 3, Set.of()))
                .isEqualTo(engine.forecast(snapshot, CLUB, 3, Set.of()));
    }
}
