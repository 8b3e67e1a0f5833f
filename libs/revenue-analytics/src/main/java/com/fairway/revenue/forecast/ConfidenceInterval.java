package com.fairway.revenue.forecast;

import java.math.BigDecimal;

/**
 * @param lowerBound lower bound, never negative
 * @param upperBound upper bound
 * @param confidence confidence scalar in [0, 1]
 */
public record ConfidenceInterval(BigDecimal lowerBound, BigDecimal upperBound, BigDecimal confidence) {
}
