package com.fairway.revenue.metrics;

import com.fairway.revenue.RevenueMath;
import com.fairway.revenue.period.RevenuePeriod;

import java.math.BigDecimal;

/**
 * Converts recurring revenue earned in a period into MRR and ARR.
 *
 * <p>Months per bucket: monthly 1, quarterly 3, yearly 12. Daily, weekly and custom windows use
 * {@code days × 12 / 365}. {@code MRR = recurring / months}, {@code ARR = recurring × 12 / months}.
 */
public final class PeriodNormalization {

    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);
    private static final BigDecimal DAYS_PER_YEAR = BigDecimal.valueOf(365);

    private PeriodNormalization() {
        // utility class
    }

    public static BigDecimal monthsIn(RevenuePeriod period) {
        return switch (period.granularity()) {
            case MONTHLY -> BigDecimal.ONE;
            case QUARTERLY -> BigDecimal.valueOf(3);
            case YEARLY -> TWELVE;
            case DAILY, WEEKLY, CUSTOM -> period.lengthInDays().multiply(TWELVE)
                    .divide(DAYS_PER_YEAR, RevenueMath.MC);
        };
    }

    public static BigDecimal monthlyRecurring(BigDecimal recurring, RevenuePeriod period) {
        return RevenueMath.money(recurring.divide(monthsIn(period), RevenueMath.MC));
    }

    public static BigDecimal annualRecurring(BigDecimal recurring, RevenuePeriod period) {
        return RevenueMath.money(recurring.multiply(TWELVE).divide(monthsIn(period), RevenueMath.MC));
    }
}
