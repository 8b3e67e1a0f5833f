package com.fairway.revenue.growth;

/** Position of a tenant's growth relative to the industry benchmark. */
public enum ComparisonResult {
    ABOVE_AVERAGE("above_average"),
    AVERAGE("average"),
    BELOW_AVERAGE("below_average");

    private final String value;

    ComparisonResult(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
