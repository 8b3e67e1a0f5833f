package com.fairway.tenant.limits;

import com.fairway.tenant.Tenant;
import com.fairway.tenant.TenantException;
import com.fairway.tenant.TenantRepository;
import com.fairway.tenant.TenantStatus;

import java.util.EnumMap;
import java.util.Map;

/**
 * Resolves effective limits along the tenant hierarchy and measures usage against them.
 *
 * <p>Effective limits are, in order of precedence, the tenant's explicit override, its tier
 * defaults, or for a child without a tier the {@link TenantLimits#childDefault child default} of
 * its parent's effective limits. The derivation itself is the pure {@link #effectiveLimits}.
 */
public class TenantLimitGovernor {

    private final TenantRepository repository;
    private final UsageCounterStore usageStore;

    public TenantLimitGovernor(TenantRepository repository, UsageCounterStore usageStore) {
        this.repository = repository;
        this.usageStore = usageStore;
    }

    /**
     * Effective limits of a tenant, walking up to its parent when needed.
     *
     * @throws TenantException TENANT_NOT_FOUND if a referenced parent is missing
     */
    public TenantLimits resolveLimits(Tenant tenant) {
        if (tenant.limitsOverride() != null || tenant.tier() != null) {
            return effectiveLimits(tenant, null);
        }
        Tenant parent = repository.findById(tenant.parentId())
                .orElseThrow(() -> TenantException.notFound(tenant.parentId()));
        return effectiveLimits(tenant, resolveLimits(parent));
    }

    /**
     * Pure derivation of a tenant's effective limits.
     *
     * @param parentEffective effective limits of the parent; only consulted for a child without
     *                        override or tier
     */
    public static TenantLimits effectiveLimits(Tenant tenant, TenantLimits parentEffective) {
        if (tenant.limitsOverride() != null) {
            return tenant.limitsOverride();
        }
        if (tenant.tier() != null) {
            return tenant.tier().defaultLimits();
        }
        if (parentEffective == null) {
            throw TenantException.invalidRequest("child tenant " + tenant.id() + " needs its parent's limits");
        }
        return TenantLimits.childDefault(parentEffective);
    }

    /** {@code max(0, usage - limit)}; an unbounded limit never overages. */
    public static long overage(long limit, long usage) {
        if (limit == TenantLimits.UNBOUNDED) {
            return 0;
        }
        return Math.max(0, usage - limit);
    }

    public TenantOverage computeOverage(Tenant tenant, TenantUsage usage) {
        TenantLimits limits = resolveLimits(tenant);
        EnumMap<GovernedResource, Long> overages = new EnumMap<>(GovernedResource.class);
        for (GovernedResource resource : GovernedResource.values()) {
            overages.put(resource, overage(limits.limit(resource), usage.get(resource)));
        }
        return new TenantOverage(tenant.id(), usage.billingPeriod(), overages);
    }

    /** Overage against the tenant's current-period usage. */
    public TenantOverage currentOverage(Tenant tenant) {
        return computeOverage(tenant, usageStore.current(tenant.id()));
    }

    /**
     * What is left of the parent's allocation once the consumption of its live children is
     * subtracted. Unbounded parent ceilings stay unbounded.
     *
     * @param excludingChildId child left out of the sum, e.g. the one being reconfigured; may be null
     */
    public Map<GovernedResource, Long> parentRemaining(Tenant parent, String excludingChildId) {
        TenantLimits parentLimits = resolveLimits(parent);
        EnumMap<GovernedResource, Long> consumed = new EnumMap<>(GovernedResource.class);
        for (Tenant child : repository.findChildren(parent.id())) {
            if (child.id().equals(excludingChildId) || child.status() == TenantStatus.DELETED) {
                continue;
            }
            TenantUsage usage = usageStore.current(child.id());
            for (GovernedResource resource : GovernedResource.values()) {
                consumed.merge(resource, usage.get(resource), Long::sum);
            }
        }
        EnumMap<GovernedResource, Long> remaining = new EnumMap<>(GovernedResource.class);
        for (GovernedResource resource : GovernedResource.values()) {
            long limit = parentLimits.limit(resource);
            remaining.put(resource, limit == TenantLimits.UNBOUNDED
                    ? TenantLimits.UNBOUNDED
                    : Math.max(0, limit - consumed.getOrDefault(resource, 0L)));
        }
        return remaining;
    }

    /**
     * Checks that explicit child limits fit in what the parent has left.
     *
     * @param childId id of the child being configured, or null for a new child
     * @throws TenantException HIERARCHY_LIMIT_EXCEEDED for the first resource that does not fit
     */
    public void validateChildAllocation(Tenant parent, String childId, TenantLimits childLimits) {
        Map<GovernedResource, Long> remaining = parentRemaining(parent, childId);
        for (GovernedResource resource : GovernedResource.values()) {
            long left = remaining.get(resource);
            long requested = childLimits.limit(resource);
            if (left != TenantLimits.UNBOUNDED && requested > left) {
                throw TenantException.hierarchyLimitExceeded(parent.id(), resource.value(), requested, left);
            }
        }
    }

    /**
     * Current consumption as a fraction of the effective limit: 0 for an unbounded resource and
     * {@link Double#POSITIVE_INFINITY} for any use of a zero ceiling.
     */
    public double usageRatio(Tenant tenant, GovernedResource resource) {
        return ratio(usageStore.current(tenant.id()).get(resource), resolveLimits(tenant).limit(resource));
    }

    static double ratio(long used, long limit) {
        if (limit == TenantLimits.UNBOUNDED) {
            return 0;
        }
        if (limit == 0) {
            return used == 0 ? 0 : Double.POSITIVE_INFINITY;
        }
        return (double) used / limit;
    }

    public UsageCounterStore usageStore() {
        return usageStore;
    }
}
