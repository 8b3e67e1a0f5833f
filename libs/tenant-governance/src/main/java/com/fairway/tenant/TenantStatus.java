package com.fairway.tenant;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Tenant lifecycle.
 *
 * <pre>
 * provisioning -> active
 * active      <-> suspended
 * active, suspended -> inactive
 * any non-deleted   -> deleted (terminal)
 * </pre>
 */
public enum TenantStatus {

    PROVISIONING("provisioning"),
    ACTIVE("active"),
    SUSPENDED("suspended"),
    INACTIVE("inactive"),
    DELETED("deleted");

    private final String value;

    TenantStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public Set<TenantStatus> allowedTargets() {
        return switch (this) {
            case PROVISIONING -> EnumSet.of(ACTIVE, DELETED);
            case ACTIVE -> EnumSet.of(SUSPENDED, INACTIVE, DELETED);
            case SUSPENDED -> EnumSet.of(ACTIVE, INACTIVE, DELETED);
            case INACTIVE -> EnumSet.of(DELETED);
            case DELETED -> EnumSet.noneOf(TenantStatus.class);
        };
    }

    public boolean canTransitionTo(TenantStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == DELETED;
    }

    public static Optional<TenantStatus> fromString(String value) {
        for (TenantStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
