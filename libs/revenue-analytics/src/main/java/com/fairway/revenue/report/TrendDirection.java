package com.fairway.revenue.report;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE
}
