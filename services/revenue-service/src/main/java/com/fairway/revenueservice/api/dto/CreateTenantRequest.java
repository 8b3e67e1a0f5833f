package com.fairway.revenueservice.api.dto;

import com.fairway.tenant.TenantCreateRequest;
import com.fairway.tenant.TenantException;
import com.fairway.tenant.TenantTier;
import com.fairway.tenant.limits.TenantLimits;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/**
 * Body of the tenant and child tenant creation endpoints.
 *
 * <p>{@code limits} adjusts the tier defaults and therefore needs a {@code tier}.
 */
public record CreateTenantRequest(
        @NotBlank String name,
        @NotBlank String slug,
        String tier,
        @Valid TenantLimitsRequest limits,
        Map<String, String> branding,
        Map<String, String> settings,
        Map<String, String> metadata) {

    public TenantCreateRequest toCreateRequest() {
        TenantTier tenantTier = tier == null
                ? null
                : TenantTier.fromString(tier)
                        .orElseThrow(() -> TenantException.invalidRequest("unknown tier: " + tier));
        TenantLimits explicit = null;
        if (limits != null) {
            if (tenantTier == null) {
                throw TenantException.invalidRequest("limits can only be adjusted together with a tier");
            }
            explicit = limits.applyTo(tenantTier.defaultLimits());
        }
        return new TenantCreateRequest(name, slug, tenantTier, explicit, branding, settings, metadata);
    }
}
