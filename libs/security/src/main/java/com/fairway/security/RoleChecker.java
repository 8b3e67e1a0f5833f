package com.fairway.security;

/**
 * Role checks with hierarchy support.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /** True if any granted role implies {@code required}. */
    public static boolean hasRole(FairwaySecurityContext context, Role required) {
        return context.roles().stream().anyMatch(granted -> granted.implies(required));
    }

    public static boolean hasAnyRole(FairwaySecurityContext context, Role... required) {
        for (Role role : required) {
            if (hasRole(context, role)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @throws AccessDeniedException if the caller lacks {@code required}
     */
    public static void requireRole(FairwaySecurityContext context, Role required) {
        if (!hasRole(context, required)) {
            throw new AccessDeniedException(
                    "user " + context.userId() + " lacks " + required.value());
        }
    }
}
