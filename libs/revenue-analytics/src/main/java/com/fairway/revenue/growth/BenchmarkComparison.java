package com.fairway.revenue.growth;

import java.math.BigDecimal;

/**
 * @param industryAverage reference quarterly growth rate
 * @param percentile      estimated percentile, 1..99
 * @param comparison      position against the average
 * @param benchmark       name of the benchmark
 */
public record BenchmarkComparison(BigDecimal industryAverage, int percentile, ComparisonResult comparison,
                                  String benchmark) {
}
