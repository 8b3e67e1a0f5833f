package com.fairway.tenant.health;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Composite health of a tenant. {@code score} is exactly the sum of the factor contributions.
 *
 * @param trends empty for a tenant's first score
 */
public record TenantHealthScore(
        String tenantId,
        BigDecimal score,
        HealthGrade grade,
        List<HealthFactor> factors,
        List<String> recommendations,
        List<HealthTrend> trends,
        Instant calculatedAt,
        Instant nextCalculationAt) {

    public TenantHealthScore {
        factors = List.copyOf(factors);
        recommendations = List.copyOf(recommendations);
        trends = List.copyOf(trends);
    }

    public Optional<HealthFactor> factor(String name) {
        return factors.stream().filter(f -> f.name().equals(name)).findFirst();
    }
}
