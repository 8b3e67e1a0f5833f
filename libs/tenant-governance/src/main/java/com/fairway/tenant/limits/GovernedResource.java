package com.fairway.tenant.limits;

import java.util.Optional;

/**
 * Resources with a per-tenant ceiling.
 *
 * <p>{@link #childDivisor()} is the fraction of a parent's limit a child receives by default:
 * a tenth for volume resources, a fifth for seats and webhooks. A divisor of zero means children
 * get none.
 */
public enum GovernedResource {

    API_CALLS("api_calls", 10),
    STORAGE_MB("storage_mb", 10),
    BANDWIDTH_MB("bandwidth_mb", 10),
    USERS("users", 5),
    COURSES("courses", 5),
    BOOKINGS("bookings", 10),
    CHILD_TENANTS("child_tenants", 0),
    CUSTOM_DOMAINS("custom_domains", 0),
    WEBHOOKS("webhooks", 5);

    private final String value;
    private final int childDivisor;

    GovernedResource(String value, int childDivisor) {
        this.value = value;
        this.childDivisor = childDivisor;
    }

    public String value() {
        return value;
    }

    public int childDivisor() {
        return childDivisor;
    }

    public static Optional<GovernedResource> fromString(String value) {
        for (GovernedResource resource : values()) {
            if (resource.value.equalsIgnoreCase(value) || resource.name().equalsIgnoreCase(value)) {
                return Optional.of(resource);
            }
        }
        return Optional.empty();
    }
}
