package com.fairway.revenueservice.api.dto;

import com.fairway.tenant.Tenant;
import java.time.Instant;
import java.util.Map;

/**
 * Read model of a tenant. Limits are served separately because they are resolved through the
 * hierarchy.
 */
public record TenantResponse(
        String id,
        String name,
        String slug,
        String tier,
        String status,
        String parentId,
        String suspensionReason,
        Instant suspendedAt,
        Map<String, String> branding,
        Map<String, String> settings,
        Map<String, String> metadata,
        Instant createdAt,
        Instant updatedAt) {

    public static TenantResponse from(Tenant tenant) {
        return new TenantResponse(
                tenant.id(),
                tenant.name(),
                tenant.slug(),
                tenant.tier() == null ? null : tenant.tier().value(),
                tenant.status().value(),
                tenant.parentId(),
                tenant.suspensionReason() == null ? null : tenant.suspensionReason().value(),
                tenant.suspendedAt(),
                tenant.branding(),
                tenant.settings(),
                tenant.metadata(),
                tenant.createdAt(),
                tenant.updatedAt());
    }
}
