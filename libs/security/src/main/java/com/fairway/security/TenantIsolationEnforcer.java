package com.fairway.security;

/**
 * Tenant isolation checks.
 * <p>
 * A caller may access a tenant's resources when it belongs to that tenant, when it belongs to the
 * tenant's parent, or when it is a platform admin.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    public static boolean canAccess(FairwaySecurityContext context, String resourceTenantId,
                                    String parentTenantId) {
        if (context.isPlatformAdmin()) {
            return true;
        }
        String own = context.tenantId();
        if (own == null) {
            return false;
        }
        return own.equals(resourceTenantId) || own.equals(parentTenantId);
    }

    /**
     * @throws AccessDeniedException if the caller belongs to a different tenant
     */
    public static void enforce(FairwaySecurityContext context, String resourceTenantId) {
        enforce(context, resourceTenantId, null);
    }

    /**
     * @param parentTenantId parent of the resource's tenant, or null for a root tenant
     * @throws AccessDeniedException if the caller belongs neither to the tenant nor to its parent
     */
    public static void enforce(FairwaySecurityContext context, String resourceTenantId,
                               String parentTenantId) {
        if (!canAccess(context, resourceTenantId, parentTenantId)) {
            throw new AccessDeniedException(
                    "tenant " + context.tenantId() + " may not access tenant " + resourceTenantId);
        }
    }

    /**
     * Tenant administrators of the tenant or of its parent, and platform administrators, may
     * perform destructive administration such as deletion.
     *
     * @throws AccessDeniedException otherwise
     */
    public static void requireTenantAdmin(FairwaySecurityContext context, String tenantId,
                                          String parentTenantId) {
        enforce(context, tenantId, parentTenantId);
        RoleChecker.requireRole(context, Role.TENANT_ADMIN);
    }
}
