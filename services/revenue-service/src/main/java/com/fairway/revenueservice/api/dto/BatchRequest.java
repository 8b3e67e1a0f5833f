package com.fairway.revenueservice.api.dto;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Tenants to process in one batch. Duplicates are collapsed.
 */
public record BatchRequest(@NotEmpty List<String> tenantIds) {

    public List<String> distinctTenantIds() {
        return tenantIds.stream().distinct().toList();
    }
}
