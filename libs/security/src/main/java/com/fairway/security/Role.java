package com.fairway.security;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Platform roles. The hierarchy is encoded here once:
 * <ul>
 *   <li>PLATFORM_ADMIN implies every other role</li>
 *   <li>TENANT_ADMIN implies BILLING_ADMIN, ANALYST and VIEWER</li>
 *   <li>BILLING_ADMIN and ANALYST imply VIEWER</li>
 * </ul>
 */
public enum Role {

    VIEWER("ROLE_VIEWER"),
    ANALYST("ROLE_ANALYST"),
    BILLING_ADMIN("ROLE_BILLING_ADMIN"),
    TENANT_ADMIN("ROLE_TENANT_ADMIN"),
    PLATFORM_ADMIN("ROLE_PLATFORM_ADMIN");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** Canonical string form, e.g. {@code ROLE_TENANT_ADMIN}. */
    public String value() {
        return value;
    }

    public Set<Role> impliedRoles() {
        return switch (this) {
            case PLATFORM_ADMIN -> EnumSet.of(VIEWER, ANALYST, BILLING_ADMIN, TENANT_ADMIN);
            case TENANT_ADMIN -> EnumSet.of(VIEWER, ANALYST, BILLING_ADMIN);
            case BILLING_ADMIN, ANALYST -> EnumSet.of(VIEWER);
            case VIEWER -> EnumSet.noneOf(Role.class);
        };
    }

    public boolean implies(Role other) {
        return this == other || impliedRoles().contains(other);
    }

    /**
     * Accepts either the canonical form ({@code ROLE_ANALYST}) or the bare name ({@code ANALYST}).
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (Role role : values()) {
            if (role.value.equals(trimmed) || role.name().equals(trimmed)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
