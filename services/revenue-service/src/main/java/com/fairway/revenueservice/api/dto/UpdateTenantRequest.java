package com.fairway.revenueservice.api.dto;

import java.util.Map;

/** Profile changes; null fields are left unchanged. */
public record UpdateTenantRequest(String name, Map<String, String> branding, Map<String, String> settings) {
}
