package com.fairway.revenueservice.api.dto;

/** New parent of a tenant; null moves it to the root. */
public record TransferTenantRequest(String parentId) {
}
