package com.fairway.tenant.limits;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One ceiling per {@link GovernedResource} plus the support terms of a tenant.
 *
 * <p>{@link #UNBOUNDED} marks a resource without a ceiling. Instances are built by the per-tier
 * factories, by {@link #childDefault(TenantLimits)} or by {@link #withLimit}, which bumps the
 * version.
 *
 * @param ceilings            ceiling per resource; every resource must be present
 * @param supportLevel        support channel
 * @param slaUptime           contractual uptime in [0, 1], null when the tier has no SLA
 * @param backupRetentionDays days backups are kept
 * @param version             configuration version, starting at 1
 */
public record TenantLimits(
        Map<GovernedResource, Long> ceilings,
        SupportLevel supportLevel,
        BigDecimal slaUptime,
        int backupRetentionDays,
        long version) {

    public static final long UNBOUNDED = Long.MAX_VALUE;

    private static final long MB_PER_GB = 1024;

    public TenantLimits {
        if (ceilings == null || supportLevel == null) {
            throw new IllegalArgumentException("ceilings and supportLevel are required");
        }
        EnumMap<GovernedResource, Long> copy = new EnumMap<>(GovernedResource.class);
        for (GovernedResource resource : GovernedResource.values()) {
            Long ceiling = ceilings.get(resource);
            if (ceiling == null || ceiling < 0) {
                throw new IllegalArgumentException("a non-negative ceiling is required for " + resource.value());
            }
            copy.put(resource, ceiling);
        }
        ceilings = Collections.unmodifiableMap(copy);
        if (slaUptime != null && (slaUptime.signum() < 0 || slaUptime.compareTo(BigDecimal.ONE) > 0)) {
            throw new IllegalArgumentException("slaUptime must be within [0, 1]");
        }
        if (backupRetentionDays < 0) {
            throw new IllegalArgumentException("backupRetentionDays must not be negative");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be positive");
        }
    }

    public long limit(GovernedResource resource) {
        return ceilings.get(resource);
    }

    public boolean isUnbounded(GovernedResource resource) {
        return limit(resource) == UNBOUNDED;
    }

    /** A copy with one ceiling replaced and the version incremented. */
    public TenantLimits withLimit(GovernedResource resource, long ceiling) {
        EnumMap<GovernedResource, Long> changed = new EnumMap<>(ceilings);
        changed.put(resource, ceiling);
        return new TenantLimits(changed, supportLevel, slaUptime, backupRetentionDays, version + 1);
    }

    /** A copy carrying {@code newVersion}. */
    public TenantLimits withVersion(long newVersion) {
        return new TenantLimits(ceilings, supportLevel, slaUptime, backupRetentionDays, newVersion);
    }

    public static TenantLimits individual() {
        return of(5_000, 1, 5, 1, 5, 20, 0, 0, 0, SupportLevel.EMAIL, null, 7);
    }

    public static TenantLimits smallBusiness() {
        return of(25_000, 10, 50, 5, 25, 500, 0, 1, 2, SupportLevel.EMAIL, "0.95", 14);
    }

    public static TenantLimits medium() {
        return of(100_000, 50, 200, 25, 100, 2_000, 3, 3, 5, SupportLevel.PRIORITY, "0.98", 30);
    }

    public static TenantLimits professional() {
        return of(100_000, 50, 200, 25, 100, 1_000, 0, 2, 3, SupportLevel.PRIORITY, "0.97", 30);
    }

    public static TenantLimits enterprise() {
        return of(1_000_000, 500, 2_000, 1_000, 1_000, 50_000, 50, 10, 20, SupportLevel.DEDICATED, "0.995", 90);
    }

    /** Every resource unbounded. */
    public static TenantLimits custom() {
        EnumMap<GovernedResource, Long> ceilings = new EnumMap<>(GovernedResource.class);
        for (GovernedResource resource : GovernedResource.values()) {
            ceilings.put(resource, UNBOUNDED);
        }
        return new TenantLimits(ceilings, SupportLevel.DEDICATED, new BigDecimal("0.999"), 365, 1);
    }

    /**
     * Default limits of a child tenant: the parent's ceiling divided by the resource's
     * {@link GovernedResource#childDivisor()}, rounded down. Unbounded parent ceilings stay
     * unbounded. Support terms are inherited.
     */
    public static TenantLimits childDefault(TenantLimits parent) {
        EnumMap<GovernedResource, Long> ceilings = new EnumMap<>(GovernedResource.class);
        for (GovernedResource resource : GovernedResource.values()) {
            long parentLimit = parent.limit(resource);
            long childLimit;
            if (resource.childDivisor() == 0) {
                childLimit = 0;
            } else if (parentLimit == UNBOUNDED) {
                childLimit = UNBOUNDED;
            } else {
                childLimit = parentLimit / resource.childDivisor();
            }
            ceilings.put(resource, childLimit);
        }
        return new TenantLimits(ceilings, parent.supportLevel(), parent.slaUptime(),
                parent.backupRetentionDays(), 1);
    }

    private static TenantLimits of(long apiCalls, long storageGb, long bandwidthGb, long users, long courses,
                                   long bookings, long childTenants, long customDomains, long webhooks,
                                   SupportLevel supportLevel, String slaUptime, int backupRetentionDays) {
        EnumMap<GovernedResource, Long> ceilings = new EnumMap<>(GovernedResource.class);
        ceilings.put(GovernedResource.API_CALLS, apiCalls);
        ceilings.put(GovernedResource.STORAGE_MB, storageGb * MB_PER_GB);
        ceilings.put(GovernedResource.BANDWIDTH_MB, bandwidthGb * MB_PER_GB);
        ceilings.put(GovernedResource.USERS, users);
        ceilings.put(GovernedResource.COURSES, courses);
        ceilings.put(GovernedResource.BOOKINGS, bookings);
        ceilings.put(GovernedResource.CHILD_TENANTS, childTenants);
        ceilings.put(GovernedResource.CUSTOM_DOMAINS, customDomains);
        ceilings.put(GovernedResource.WEBHOOKS, webhooks);
        return new TenantLimits(ceilings, supportLevel, slaUptime == null ? null : new BigDecimal(slaUptime),
                backupRetentionDays, 1);
    }
}
