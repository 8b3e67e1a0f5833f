package com.fairway.revenueservice.api;

import com.fairway.security.FairwaySecurityContext;
import com.fairway.security.Role;
import com.fairway.security.RoleChecker;
import com.fairway.security.TenantIsolationEnforcer;
import com.fairway.tenant.Tenant;
import com.fairway.tenant.TenantRepository;

/**
 * Request-level authorization shared by the controllers.
 *
 * <p>A {@code null} tenant id addresses the whole platform and is reserved to platform admins.
 * Tenants that do not exist are checked as root tenants, so a caller from another tenant is
 * denied before it can learn whether the tenant exists.
 */
class AccessGuard {

    private final TenantRepository tenants;

    AccessGuard(TenantRepository tenants) {
        this.tenants = tenants;
    }

    void require(FairwaySecurityContext context, String tenantId, Role role) {
        if (tenantId == null) {
            RoleChecker.requireRole(context, Role.PLATFORM_ADMIN);
            return;
        }
        String parentId = tenants.findById(tenantId).map(Tenant::parentId).orElse(null);
        TenantIsolationEnforcer.enforce(context, tenantId, parentId);
        RoleChecker.requireRole(context, role);
    }

    void requirePlatformAdmin(FairwaySecurityContext context) {
        RoleChecker.requireRole(context, Role.PLATFORM_ADMIN);
    }
}
