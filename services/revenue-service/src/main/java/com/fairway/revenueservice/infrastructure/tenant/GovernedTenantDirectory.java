package com.fairway.revenueservice.infrastructure.tenant;

import com.fairway.revenue.TenantDirectory;
import com.fairway.tenant.Tenant;
import com.fairway.tenant.TenantRepository;
import com.fairway.tenant.TenantStatus;
import java.util.Optional;

/**
 * Tenant lookup for revenue analytics backed by the governance repository. Deleted tenants are
 * unknown to analytics.
 */
public class GovernedTenantDirectory implements TenantDirectory {

    private final TenantRepository repository;

    public GovernedTenantDirectory(TenantRepository repository) {
        this.repository = repository;
    }

    @Override
    public boolean exists(String tenantId) {
        return live(tenantId).isPresent();
    }

    @Override
    public Optional<String> displayName(String tenantId) {
        return live(tenantId).map(Tenant::name);
    }

    private Optional<Tenant> live(String tenantId) {
        return repository.findById(tenantId).filter(tenant -> tenant.status() != TenantStatus.DELETED);
    }
}
