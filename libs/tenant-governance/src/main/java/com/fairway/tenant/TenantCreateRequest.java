package com.fairway.tenant;

import com.fairway.tenant.limits.TenantLimits;

import java.util.Map;

/**
 * Input for creating a tenant or a child tenant.
 *
 * @param tier   required for a root tenant; optional for a child, which otherwise derives its limits
 * @param limits explicit limits, or null for the tier or parent defaults
 */
public record TenantCreateRequest(
        String name,
        String slug,
        TenantTier tier,
        TenantLimits limits,
        Map<String, String> branding,
        Map<String, String> settings,
        Map<String, String> metadata) {

    public static TenantCreateRequest of(String name, String slug, TenantTier tier) {
        return new TenantCreateRequest(name, slug, tier, null, null, null, null);
    }

    public TenantCreateRequest withLimits(TenantLimits newLimits) {
        return new TenantCreateRequest(name, slug, tier, newLimits, branding, settings, metadata);
    }
}
