package com.fairway.revenue;

import java.util.Optional;

/**
 * Lookup of known tenants, supplied by tenant governance.
 */
public interface TenantDirectory {

    boolean exists(String tenantId);

    Optional<String> displayName(String tenantId);

    /** Accepts every tenant id; for tests and single-tenant deployments. */
    static TenantDirectory acceptingAll() {
        return new TenantDirectory() {
            @Override
            public boolean exists(String tenantId) {
                return tenantId != null && !tenantId.isBlank();
            }

            @Override
            public Optional<String> displayName(String tenantId) {
                return Optional.ofNullable(tenantId);
            }
        };
    }
}
