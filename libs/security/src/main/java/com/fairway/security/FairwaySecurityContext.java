package com.fairway.security;

import java.util.List;

/**
 * Who is calling, on behalf of which tenant, and with which roles.
 *
 * @param user          authenticated caller
 * @param tenantId      tenant the caller belongs to; platform staff carry the platform tenant
 * @param roles         granted roles (hierarchy applied by {@link RoleChecker})
 * @param correlationId correlation id of the request
 */
public record FairwaySecurityContext(
        AuthenticatedUser user,
        String tenantId,
        List<Role> roles,
        String correlationId) {

    public FairwaySecurityContext {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public boolean isPlatformAdmin() {
        return roles.contains(Role.PLATFORM_ADMIN);
    }

    public String userId() {
        return user == null ? null : user.userId();
    }
}
