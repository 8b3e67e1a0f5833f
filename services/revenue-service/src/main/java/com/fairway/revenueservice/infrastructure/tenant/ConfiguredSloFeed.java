package com.fairway.revenueservice.infrastructure.tenant;

import com.fairway.revenueservice.config.RevenueProperties;
import com.fairway.tenant.health.SloFeed;
import com.fairway.tenant.health.SloSnapshot;
import java.time.Clock;

/**
 * Reports the configured service-level figures for every tenant.
 */
public class ConfiguredSloFeed implements SloFeed {

    private final RevenueProperties.Slo slo;
    private final Clock clock;

    public ConfiguredSloFeed(RevenueProperties.Slo slo, Clock clock) {
        this.slo = slo;
        this.clock = clock;
    }

    @Override
    public SloSnapshot fetch(String tenantId) {
        return new SloSnapshot(slo.uptime(), slo.errorRate(), slo.satisfactionRating(), clock.instant());
    }
}
