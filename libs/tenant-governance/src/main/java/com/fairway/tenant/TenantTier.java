package com.fairway.tenant;

import com.fairway.tenant.limits.TenantLimits;

import java.util.Optional;

/**
 * Commercial tiers. Each tier carries a default set of {@link TenantLimits}.
 */
public enum TenantTier {

    INDIVIDUAL("individual"),
    SMALL_BUSINESS("small_business"),
    MEDIUM("medium"),
    PROFESSIONAL("professional"),
    ENTERPRISE("enterprise"),
    CUSTOM("custom");

    private final String value;

    TenantTier(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public TenantLimits defaultLimits() {
        return switch (this) {
            case INDIVIDUAL -> TenantLimits.individual();
            case SMALL_BUSINESS -> TenantLimits.smallBusiness();
            case MEDIUM -> TenantLimits.medium();
            case PROFESSIONAL -> TenantLimits.professional();
            case ENTERPRISE -> TenantLimits.enterprise();
            case CUSTOM -> TenantLimits.custom();
        };
    }

    public static Optional<TenantTier> fromString(String value) {
        for (TenantTier tier : values()) {
            if (tier.value.equalsIgnoreCase(value) || tier.name().equalsIgnoreCase(value)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
