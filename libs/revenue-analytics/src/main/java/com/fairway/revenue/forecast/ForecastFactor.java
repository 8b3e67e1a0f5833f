package com.fairway.revenue.forecast;

import java.math.BigDecimal;

/**
 * A named influence reported next to a forecast point. Factors explain the number; they are not
 * applied to it.
 *
 * @param name        {@code growth_trend}, {@code volatility} or {@code seasonality}
 * @param impact      relative effect, as a fraction of mean monthly net revenue
 * @param confidence  how much the factor can be trusted, in [0, 1]
 * @param description human-readable explanation
 */
public record ForecastFactor(String name, BigDecimal impact, BigDecimal confidence, String description) {
}
