package com.fairway.tenant;

import com.fairway.tenant.health.TenantHealthScore;
import com.fairway.tenant.limits.GovernedResource;
import com.fairway.tenant.limits.TenantLimits;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Governance data of one tenant as exported for backup or for seeding another tenant.
 *
 * <p>Only {@code branding}, {@code settings} and {@code limitsOverride} are taken over on import;
 * the other fields describe the source tenant. Domain records such as members and bookings move
 * through tenant data migrations instead.
 *
 * @param limitsOverride explicit limits of the tenant, or null when it resolves them from tier or parent
 * @param usage          consumption of the current billing period
 */
public record TenantDataExport(
        String tenantId,
        String name,
        String slug,
        TenantTier tier,
        String parentId,
        TenantStatus status,
        TenantLimits limitsOverride,
        TenantLimits effectiveLimits,
        Map<String, String> branding,
        Map<String, String> settings,
        Map<String, String> metadata,
        Map<GovernedResource, Long> usage,
        List<TenantHealthScore> healthHistory,
        Instant exportedAt) {

    public TenantDataExport {
        branding = branding == null ? Map.of() : Map.copyOf(branding);
        settings = settings == null ? Map.of() : Map.copyOf(settings);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        usage = usage == null ? Map.of() : Map.copyOf(usage);
        healthHistory = healthHistory == null ? List.of() : List.copyOf(healthHistory);
    }
}
