package com.fairway.revenue;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * Decimal conventions shared by all revenue computations.
 * <p>
 * Money is reported at scale {@value #MONEY_SCALE}, rates and confidences at scale
 * {@value #RATE_SCALE}, always with banker's rounding. Intermediate statistics use
 * {@link #MC}.
 */
public final class RevenueMath {

    public static final int MONEY_SCALE = 4;
    public static final int RATE_SCALE = 6;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;
    public static final MathContext MC = new MathContext(24, ROUNDING);

    private RevenueMath() {
        // utility class
    }

    public static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, ROUNDING);
    }

    public static BigDecimal rate(BigDecimal value) {
        return value.setScale(RATE_SCALE, ROUNDING);
    }

    /** {@code numerator / denominator} at rate scale; zero when the denominator is zero. */
    public static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() == 0) {
            return rate(BigDecimal.ZERO);
        }
        return numerator.divide(denominator, RATE_SCALE, ROUNDING);
    }

    public static BigDecimal mean(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal v : values) {
            sum = sum.add(v);
        }
        return sum.divide(BigDecimal.valueOf(values.size()), MC);
    }

    /** Sample standard deviation (n − 1 denominator); zero for fewer than two values. */
    public static BigDecimal sampleStdDev(List<BigDecimal> values) {
        if (values.size() < 2) {
            return BigDecimal.ZERO;
        }
        BigDecimal mean = mean(values);
        BigDecimal squares = BigDecimal.ZERO;
        for (BigDecimal v : values) {
            BigDecimal d = v.subtract(mean);
            squares = squares.add(d.multiply(d));
        }
        return squares.divide(BigDecimal.valueOf(values.size() - 1L), MC).sqrt(MC);
    }

    public static BigDecimal clamp(BigDecimal value, BigDecimal min, BigDecimal max) {
        return value.max(min).min(max);
    }
}
