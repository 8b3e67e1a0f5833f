package com.fairway.tenant;

import com.fairway.common.batch.BatchResult;
import com.fairway.common.batch.BatchRunner;
import com.fairway.security.AccessDeniedException;
import com.fairway.security.FairwaySecurityContext;
import com.fairway.security.TenantIsolationEnforcer;
import com.fairway.tenant.health.TenantHealthScore;
import com.fairway.tenant.health.TenantHealthScorer;
import com.fairway.tenant.limits.GovernedResource;
import com.fairway.tenant.limits.TenantLimitGovernor;
import com.fairway.tenant.limits.TenantLimits;
import com.fairway.tenant.limits.TenantOverage;
import com.fairway.tenant.limits.TenantUsage;
import com.fairway.tenant.migration.MigrationOptions;
import com.fairway.tenant.migration.MigrationResult;
import com.fairway.tenant.migration.MigrationStatus;
import com.fairway.tenant.migration.TenantMigrationCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Command and query surface of tenant governance: lifecycle, limits, usage, health and migrations.
 *
 * <p>Changes to a parent's set of children (creating, re-parenting, reconfiguring a child's
 * limits) run under a per-parent lock, so the child count and allocation checks hold when the
 * change is stored. Registered {@link TenantListener}s hear about every stored change.
 */
public class TenantGovernanceService {

    private static final Logger log = LoggerFactory.getLogger(TenantGovernanceService.class);

    private static final Pattern SLUG = Pattern.compile("^[a-z0-9-]+$");

    private final TenantRepository repository;
    private final TenantLimitGovernor governor;
    private final TenantHealthScorer healthScorer;
    private final TenantMigrationCoordinator migrations;
    private final BatchRunner batchRunner;
    private final Clock clock;
    private final List<TenantListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, Object> hierarchyLocks = new ConcurrentHashMap<>();

    public TenantGovernanceService(
            TenantRepository repository,
            TenantLimitGovernor governor,
            TenantHealthScorer healthScorer,
            TenantMigrationCoordinator migrations,
            BatchRunner batchRunner,
            Clock clock) {
        this.repository = repository;
        this.governor = governor;
        this.healthScorer = healthScorer;
        this.migrations = migrations;
        this.batchRunner = batchRunner;
        this.clock = clock;
    }

    public void addListener(TenantListener listener) {
        listeners.add(listener);
    }

    public void removeListener(TenantListener listener) {
        listeners.remove(listener);
    }

    // ---- Lifecycle ----

    /**
     * Creates a root tenant and activates it once provisioned.
     *
     * @throws TenantException INVALID_REQUEST or SLUG_ALREADY_EXISTS
     */
    public Tenant createTenant(TenantCreateRequest request) {
        validate(request);
        if (request.tier() == null) {
            throw TenantException.invalidRequest("tier is required");
        }
        return provision(request, null);
    }

    /**
     * Creates a tenant under an active parent whose limits allow another child.
     *
     * @throws TenantException TENANT_NOT_FOUND, TENANT_NOT_ACTIVE, CHILD_TENANTS_NOT_ALLOWED,
     *                         CHILD_TENANT_LIMIT_REACHED or HIERARCHY_LIMIT_EXCEEDED
     */
    public Tenant createChildTenant(String parentId, TenantCreateRequest request) {
        validate(request);
        Tenant parent = get(parentId);
        synchronized (hierarchyLock(parentId)) {
            requireRoomForChild(parent);
            TenantLimits allocation = request.limits() != null ? request.limits()
                    : request.tier() != null ? request.tier().defaultLimits() : null;
            if (allocation != null) {
                governor.validateChildAllocation(parent, null, allocation);
            }
            return provision(request, parentId);
        }
    }

    /**
     * Moves a tenant under another parent, or makes it a root tenant when {@code newParentId} is
     * null. The new parent must be active, have room for another child and must not sit below the
     * tenant. Explicit or tier limits of the tenant must fit in the new parent's remaining
     * allocation. Moving a tenant under its current parent changes nothing.
     *
     * @throws TenantException TENANT_NOT_FOUND, TENANT_NOT_ACTIVE, CHILD_TENANTS_NOT_ALLOWED,
     *                         CHILD_TENANT_LIMIT_REACHED, HIERARCHY_LIMIT_EXCEEDED, HIERARCHY_CYCLE
     *                         or INVALID_REQUEST for a root tenant without a tier
     */
    public Tenant transferTenant(String tenantId, String newParentId) {
        Tenant tenant = get(tenantId);
        if (tenant.status() == TenantStatus.DELETED) {
            throw TenantException.notActive(tenantId);
        }
        if (Objects.equals(newParentId, tenant.parentId())) {
            return tenant;
        }
        if (newParentId == null) {
            tenant.reparent(null, clock.instant());
            return updated(tenant, "moved to the root");
        }
        Tenant newParent = get(newParentId);
        if (isAncestorOrSelf(tenantId, newParent)) {
            throw TenantException.hierarchyCycle(tenantId, newParentId);
        }
        synchronized (hierarchyLock(newParentId)) {
            requireRoomForChild(newParent);
            TenantLimits allocation = tenant.limitsOverride() != null ? tenant.limitsOverride()
                    : tenant.tier() != null ? tenant.tier().defaultLimits() : null;
            if (allocation != null) {
                governor.validateChildAllocation(newParent, tenantId, allocation);
            }
            tenant.reparent(newParentId, clock.instant());
            return updated(tenant, "moved under " + newParentId);
        }
    }

    /** Direct children that are not deleted. */
    public List<Tenant> listChildren(String parentId) {
        get(parentId);
        return liveChildren(parentId);
    }

    public List<Tenant> listTenants() {
        return repository.findAll();
    }

    /**
     * @throws TenantException TENANT_NOT_FOUND
     */
    public Tenant get(String tenantId) {
        return repository.findById(tenantId).orElseThrow(() -> TenantException.notFound(tenantId));
    }

    public Optional<Tenant> findBySlug(String slug) {
        return repository.findBySlug(slug);
    }

    /** Changes name, branding or settings; null arguments leave the current value. */
    public Tenant updateTenant(String tenantId, String name, Map<String, String> branding,
                               Map<String, String> settings) {
        Tenant tenant = get(tenantId);
        Instant now = clock.instant();
        if (name != null) {
            if (name.isBlank()) {
                throw TenantException.invalidRequest("name must not be blank");
            }
            tenant.rename(name, now);
        }
        if (branding != null) {
            tenant.configureBranding(branding, now);
        }
        if (settings != null) {
            tenant.configureSettings(settings, now);
        }
        return updated(tenant, "updated");
    }

    public Tenant activate(String tenantId) {
        Tenant tenant = get(tenantId);
        TenantStatus from = tenant.status();
        tenant.activate(clock.instant());
        return transitioned(tenant, from, "activated");
    }

    /**
     * @throws TenantException SUSPENSION_REASON_REQUIRED or INVALID_STATUS_TRANSITION; the
     *                         status is unchanged in both cases
     */
    public Tenant suspend(String tenantId, SuspensionReason reason) {
        Tenant tenant = get(tenantId);
        TenantStatus from = tenant.status();
        tenant.suspend(reason, clock.instant());
        log.warn("Tenant {} suspended: {}", tenantId, reason.value());
        return transitioned(tenant, from, "suspended");
    }

    public Tenant reactivate(String tenantId) {
        Tenant tenant = get(tenantId);
        TenantStatus from = tenant.status();
        tenant.reactivate(clock.instant());
        return transitioned(tenant, from, "reactivated");
    }

    public Tenant deactivate(String tenantId) {
        Tenant tenant = get(tenantId);
        TenantStatus from = tenant.status();
        tenant.deactivate(clock.instant());
        return transitioned(tenant, from, "deactivated");
    }

    /**
     * Deletes a tenant, first moving its data to {@code transferToTenantId} when one is given.
     * The tenant is only deleted once that transfer completed. Only tenant administrators of the
     * tenant or of its parent, and platform administrators, may delete.
     *
     * @return the data transfer, when one ran
     * @throws AccessDeniedException   when the caller may not administer the tenant, including
     *                                 when a non-platform caller names an unknown tenant
     * @throws TenantException DELETION_NOT_ALLOWED while live child tenants remain,
     *                         DATA_TRANSFER_INCOMPLETE when the transfer did not complete; the
     *                         tenant keeps its status and the transfer stays queryable by id
     */
    public Optional<MigrationResult> delete(String tenantId, FairwaySecurityContext context,
                                            String transferToTenantId) {
        Optional<Tenant> found = repository.findById(tenantId);
        if (found.isEmpty()) {
            if (context.isPlatformAdmin()) {
                throw TenantException.notFound(tenantId);
            }
            throw new AccessDeniedException("delete of unknown tenant " + tenantId);
        }
        Tenant tenant = found.get();
        TenantIsolationEnforcer.requireTenantAdmin(context, tenant.id(), tenant.parentId());
        if (tenant.status() == TenantStatus.DELETED) {
            throw TenantException.invalidTransition(tenantId, TenantStatus.DELETED, TenantStatus.DELETED);
        }
        if (!liveChildren(tenantId).isEmpty()) {
            throw TenantException.deletionNotAllowed(
                    "Tenant " + tenantId + " still has child tenants; delete them first");
        }

        MigrationResult transfer = null;
        if (transferToTenantId != null) {
            transfer = migrate(tenantId, transferToTenantId, MigrationOptions.dataTransfer());
            if (transfer.status() != MigrationStatus.COMPLETED) {
                log.warn("Tenant {} kept: data transfer {} ended {}", tenantId, transfer.migrationId(),
                        transfer.status().value());
                throw TenantException.transferIncomplete(tenantId, transfer.migrationId(),
                        transfer.status().value());
            }
        }
        TenantStatus from = tenant.status();
        tenant.markDeleted(clock.instant());
        transitioned(tenant, from, "deleted by " + context.userId());
        return Optional.ofNullable(transfer);
    }

    // ---- Limits and usage ----

    public TenantLimits limits(String tenantId) {
        return governor.resolveLimits(get(tenantId));
    }

    /**
     * Replaces a tenant's explicit limits. A child's new limits must fit in its parent's
     * remaining allocation. The stored version continues from the current effective version.
     *
     * @throws TenantException HIERARCHY_LIMIT_EXCEEDED
     */
    public TenantLimits configureLimits(String tenantId, TenantLimits limits) {
        if (limits == null) {
            throw TenantException.invalidRequest("limits are required");
        }
        Tenant tenant = get(tenantId);
        TenantLimits versioned = applyLimits(tenant, limits);
        updated(tenant, "limits configured (version " + versioned.version() + ")");
        return versioned;
    }

    /**
     * Adds consumption for the current billing period.
     *
     * @return the new counter value
     * @throws TenantException TENANT_NOT_ACTIVE unless the tenant is active
     */
    public long recordUsage(String tenantId, GovernedResource resource, long amount) {
        Tenant tenant = get(tenantId);
        if (tenant.status() != TenantStatus.ACTIVE) {
            throw TenantException.notActive(tenantId);
        }
        if (amount < 0) {
            throw TenantException.invalidRequest("usage amount must not be negative");
        }
        long limit = governor.resolveLimits(tenant).limit(resource);
        long usage = governor.usageStore().increment(tenantId, resource, amount);
        if (limit != TenantLimits.UNBOUNDED && usage > limit && usage - amount <= limit) {
            log.warn("Tenant {} exceeded its {} limit: {} of {}", tenantId, resource.value(), usage, limit);
            notifyListeners(listener -> listener.usageExceededLimit(tenant, resource, usage, limit));
        }
        return usage;
    }

    public TenantUsage usage(String tenantId) {
        get(tenantId);
        return governor.usageStore().current(tenantId);
    }

    public TenantOverage overage(String tenantId) {
        return governor.currentOverage(get(tenantId));
    }

    /** What the parent has left to allocate to new or reconfigured children. */
    public Map<GovernedResource, Long> remainingAllocation(String parentId) {
        return governor.parentRemaining(get(parentId), null);
    }

    // ---- Health ----

    public TenantHealthScore healthScore(String tenantId) {
        Tenant tenant = get(tenantId);
        Optional<BigDecimal> previous = healthScorer.latest(tenantId).map(TenantHealthScore::score);
        TenantHealthScore score = healthScorer.score(tenant);
        previous.filter(before -> before.compareTo(score.score()) != 0)
                .ifPresent(before -> notifyListeners(
                        listener -> listener.healthScoreChanged(tenant, before, score.score())));
        return score;
    }

    public List<TenantHealthScore> healthHistory(String tenantId) {
        get(tenantId);
        return healthScorer.history(tenantId);
    }

    /** Scores every tenant that is not deleted; one failing tenant never stops the others. */
    public BatchResult<String, TenantHealthScore> allTenantsHealth() {
        List<String> ids = repository.findAll().stream()
                .filter(tenant -> tenant.status() != TenantStatus.DELETED)
                .map(Tenant::id)
                .toList();
        return batchRunner.run("tenant.health", ids, this::healthScore);
    }

    // ---- Migrations ----

    /**
     * @throws TenantException TENANT_NOT_FOUND, INVALID_REQUEST for the same tenant twice,
     *                         TENANT_NOT_ACTIVE if the target is not active
     */
    public MigrationResult migrate(String fromTenantId, String toTenantId, MigrationOptions options) {
        if (fromTenantId.equals(toTenantId)) {
            throw TenantException.invalidRequest("source and target tenant must differ");
        }
        Tenant from = get(fromTenantId);
        Tenant to = get(toTenantId);
        if (from.status() == TenantStatus.DELETED) {
            throw TenantException.notActive(fromTenantId);
        }
        if (to.status() != TenantStatus.ACTIVE) {
            throw TenantException.notActive(toTenantId);
        }
        return migrations.migrate(fromTenantId, toTenantId, options == null ? MigrationOptions.fullMigration() : options);
    }

    public MigrationResult migration(String migrationId) {
        return migrations.find(migrationId).orElseThrow(() -> TenantException.migrationNotFound(migrationId));
    }

    public MigrationResult cancelMigration(String migrationId) {
        return migrations.cancel(migrationId);
    }

    // ---- Export and import ----

    public TenantDataExport exportTenantData(String tenantId) {
        Tenant tenant = get(tenantId);
        TenantDataExport export = new TenantDataExport(tenant.id(), tenant.name(), tenant.slug(), tenant.tier(),
                tenant.parentId(), tenant.status(), tenant.limitsOverride(), governor.resolveLimits(tenant),
                tenant.branding(), tenant.settings(), tenant.metadata(),
                governor.usageStore().current(tenantId).consumption(), healthScorer.history(tenantId),
                clock.instant());
        log.info("Tenant {} exported", tenantId);
        return export;
    }

    /**
     * Applies the branding, settings and explicit limits of an export to an existing tenant.
     * Identity, hierarchy, usage and health history of the target are kept. Limits are checked
     * against the parent's allocation before anything changes.
     *
     * @throws TenantException TENANT_NOT_FOUND, HIERARCHY_LIMIT_EXCEEDED, or
     *                         INVALID_STATUS_TRANSITION for a deleted tenant
     */
    public Tenant importTenantData(String tenantId, TenantDataExport data) {
        if (data == null) {
            throw TenantException.invalidRequest("import data is required");
        }
        Tenant tenant = get(tenantId);
        if (data.limitsOverride() != null) {
            applyLimits(tenant, data.limitsOverride());
        }
        Instant now = clock.instant();
        tenant.configureBranding(data.branding(), now);
        tenant.configureSettings(data.settings(), now);
        return updated(tenant, "imported from " + data.tenantId());
    }

    private Tenant provision(TenantCreateRequest request, String parentId) {
        if (repository.findBySlug(request.slug()).isPresent()) {
            throw TenantException.slugAlreadyExists(request.slug());
        }
        Instant now = clock.instant();
        Tenant tenant = new Tenant(UUID.randomUUID().toString(), request.name(), request.slug(), request.tier(),
                parentId, request.limits(), request.branding(), request.settings(), request.metadata(), now);
        repository.save(tenant);
        tenant.activate(now);
        repository.save(tenant);
        log.info("Tenant {} ({}) created{}", tenant.id(), tenant.slug(),
                parentId == null ? "" : " under " + parentId);
        notifyListeners(listener -> listener.tenantCreated(tenant));
        return tenant;
    }

    private void requireRoomForChild(Tenant parent) {
        if (parent.status() != TenantStatus.ACTIVE) {
            throw TenantException.notActive(parent.id());
        }
        long maxChildren = governor.resolveLimits(parent).limit(GovernedResource.CHILD_TENANTS);
        if (maxChildren == 0) {
            throw TenantException.childTenantsNotAllowed(parent.id());
        }
        if (liveChildren(parent.id()).size() >= maxChildren) {
            throw TenantException.childTenantLimitReached(parent.id(), maxChildren);
        }
    }

    /** Validates and stores explicit limits; the version continues from the current effective one. */
    private TenantLimits applyLimits(Tenant tenant, TenantLimits limits) {
        if (!tenant.isChild()) {
            return storeLimits(tenant, limits);
        }
        String parentId = tenant.parentId();
        synchronized (hierarchyLock(parentId)) {
            governor.validateChildAllocation(get(parentId), tenant.id(), limits);
            return storeLimits(tenant, limits);
        }
    }

    private TenantLimits storeLimits(Tenant tenant, TenantLimits limits) {
        TenantLimits versioned = limits.withVersion(governor.resolveLimits(tenant).version() + 1);
        tenant.configureLimits(versioned, clock.instant());
        return versioned;
    }

    private boolean isAncestorOrSelf(String tenantId, Tenant candidate) {
        Set<String> seen = new HashSet<>();
        Tenant current = candidate;
        while (current != null && seen.add(current.id())) {
            if (current.id().equals(tenantId)) {
                return true;
            }
            current = current.parentId() == null ? null : repository.findById(current.parentId()).orElse(null);
        }
        return false;
    }

    private Object hierarchyLock(String parentId) {
        return hierarchyLocks.computeIfAbsent(parentId, id -> new Object());
    }

    private List<Tenant> liveChildren(String parentId) {
        return repository.findChildren(parentId).stream()
                .filter(child -> child.status() != TenantStatus.DELETED)
                .toList();
    }

    private Tenant saved(Tenant tenant, String what) {
        repository.save(tenant);
        log.info("Tenant {} {}", tenant.id(), what);
        return tenant;
    }

    private Tenant updated(Tenant tenant, String what) {
        saved(tenant, what);
        notifyListeners(listener -> listener.tenantUpdated(tenant));
        return tenant;
    }

    private Tenant transitioned(Tenant tenant, TenantStatus from, String what) {
        saved(tenant, what);
        TenantStatus to = tenant.status();
        notifyListeners(listener -> listener.statusChanged(tenant, from, to));
        return tenant;
    }

    private void notifyListeners(Consumer<TenantListener> event) {
        for (TenantListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                // the change is stored; a listener failure must not surface as a governance failure
                log.error("Tenant listener {} failed", listener, e);
            }
        }
    }

    private static void validate(TenantCreateRequest request) {
        if (request == null) {
            throw TenantException.invalidRequest("request is required");
        }
        if (request.name() == null || request.name().isBlank()) {
            throw TenantException.invalidRequest("name is required");
        }
        if (request.slug() == null || !SLUG.matcher(request.slug()).matches()) {
            throw TenantException.invalidRequest("slug must contain only lowercase letters, digits and hyphens");
        }
    }
}
