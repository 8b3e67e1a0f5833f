package com.fairway.tenant.health;

/**
 * Source of service-level observations for a tenant (uptime, error rate, customer satisfaction).
 * Implementations typically call a monitoring system and may be slow or fail.
 */
@FunctionalInterface
public interface SloFeed {

    SloSnapshot fetch(String tenantId);
}
