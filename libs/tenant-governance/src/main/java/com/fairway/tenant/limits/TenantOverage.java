package com.fairway.tenant.limits;

import java.time.YearMonth;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-resource {@code max(0, usage - effective limit)} for one billing period.
 */
public record TenantOverage(String tenantId, YearMonth billingPeriod, Map<GovernedResource, Long> overages) {

    public TenantOverage {
        EnumMap<GovernedResource, Long> copy = new EnumMap<>(GovernedResource.class);
        copy.putAll(overages);
        overages = Collections.unmodifiableMap(copy);
    }

    public long get(GovernedResource resource) {
        return overages.getOrDefault(resource, 0L);
    }

    public boolean hasOverage() {
        return overages.values().stream().anyMatch(value -> value > 0);
    }
}
