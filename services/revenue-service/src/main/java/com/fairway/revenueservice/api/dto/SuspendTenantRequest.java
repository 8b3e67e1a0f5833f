package com.fairway.revenueservice.api.dto;

/** A missing reason is rejected by the tenant lifecycle, not by bean validation. */
public record SuspendTenantRequest(String reason) {
}
