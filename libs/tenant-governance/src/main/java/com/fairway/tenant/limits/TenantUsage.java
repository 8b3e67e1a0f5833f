package com.fairway.tenant.limits;

import java.time.YearMonth;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Consumption of one tenant in one billing period. Resources without a recorded value read as 0.
 */
public record TenantUsage(String tenantId, YearMonth billingPeriod, Map<GovernedResource, Long> consumption) {

    public TenantUsage {
        EnumMap<GovernedResource, Long> copy = new EnumMap<>(GovernedResource.class);
        if (consumption != null) {
            copy.putAll(consumption);
        }
        consumption = Collections.unmodifiableMap(copy);
    }

    public static TenantUsage empty(String tenantId, YearMonth billingPeriod) {
        return new TenantUsage(tenantId, billingPeriod, Map.of());
    }

    public long get(GovernedResource resource) {
        return consumption.getOrDefault(resource, 0L);
    }
}
