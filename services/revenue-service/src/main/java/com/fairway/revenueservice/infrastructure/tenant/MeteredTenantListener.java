package com.fairway.revenueservice.infrastructure.tenant;

import com.fairway.observability.MetricFactory;
import com.fairway.tenant.Tenant;
import com.fairway.tenant.TenantListener;
import com.fairway.tenant.TenantStatus;
import com.fairway.tenant.limits.GovernedResource;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts tenant lifecycle transitions and limit crossings per tenant and logs health swings.
 */
public class MeteredTenantListener implements TenantListener {

    private static final Logger log = LoggerFactory.getLogger(MeteredTenantListener.class);

    private final MetricFactory metrics;

    public MeteredTenantListener(MetricFactory metrics) {
        this.metrics = metrics;
    }

    @Override
    public void statusChanged(Tenant tenant, TenantStatus from, TenantStatus to) {
        metrics.tenantCounter("tenant.status.changes", "Tenant lifecycle transitions", tenant.id(),
                "to", to.value()).increment();
    }

    @Override
    public void usageExceededLimit(Tenant tenant, GovernedResource resource, long usage, long limit) {
        metrics.tenantCounter("tenant.limit.exceeded", "Usage records that crossed a tenant limit", tenant.id(),
                "resource", resource.value()).increment();
    }

    @Override
    public void healthScoreChanged(Tenant tenant, BigDecimal previousScore, BigDecimal newScore) {
        log.info("Tenant {} health score moved from {} to {}", tenant.id(), previousScore, newScore);
    }
}
