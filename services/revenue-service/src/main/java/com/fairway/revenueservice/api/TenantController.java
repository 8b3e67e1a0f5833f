package com.fairway.revenueservice.api;

import com.fairway.revenueservice.api.dto.BatchResponse;
import com.fairway.revenueservice.api.dto.CreateTenantRequest;
import com.fairway.revenueservice.api.dto.MigrationRequest;
import com.fairway.revenueservice.api.dto.RecordUsageRequest;
import com.fairway.revenueservice.api.dto.SuspendTenantRequest;
import com.fairway.revenueservice.api.dto.TenantLimitsRequest;
import com.fairway.revenueservice.api.dto.TenantResponse;
import com.fairway.revenueservice.api.dto.TransferTenantRequest;
import com.fairway.revenueservice.api.dto.UpdateTenantRequest;
import com.fairway.security.FairwaySecurityContext;
import com.fairway.security.Role;
import com.fairway.tenant.SuspensionReason;
import com.fairway.tenant.Tenant;
import com.fairway.tenant.TenantDataExport;
import com.fairway.tenant.TenantException;
import com.fairway.tenant.TenantGovernanceService;
import com.fairway.tenant.TenantRepository;
import com.fairway.tenant.health.TenantHealthScore;
import com.fairway.tenant.limits.GovernedResource;
import com.fairway.tenant.limits.TenantLimits;
import com.fairway.tenant.limits.TenantOverage;
import com.fairway.tenant.limits.TenantUsage;
import com.fairway.tenant.migration.MigrationResult;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface of tenant governance: hierarchy, lifecycle, limits and usage, health and
 * migrations.
 *
 * <p>Platform admins create root tenants, change their limits and suspend or reactivate tenants.
 * Tenant admins manage their own tenant and its children; a child's limits are set by the
 * parent's admins.
 */
@RestController
@RequestMapping("/api/v1/tenants")
public class TenantController {

    private final TenantGovernanceService governance;
    private final AccessGuard guard;

    public TenantController(TenantGovernanceService governance, TenantRepository tenants) {
        this.governance = governance;
        this.guard = new AccessGuard(tenants);
    }

    // ---- Hierarchy ----

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TenantResponse create(@Valid @RequestBody CreateTenantRequest request,
                                 FairwaySecurityContext context) {
        guard.requirePlatformAdmin(context);
        return TenantResponse.from(governance.createTenant(request.toCreateRequest()));
    }

    @PostMapping("/{parentId}/children")
    @ResponseStatus(HttpStatus.CREATED)
    public TenantResponse createChild(@PathVariable String parentId,
                                      @Valid @RequestBody CreateTenantRequest request,
                                      FairwaySecurityContext context) {
        guard.require(context, parentId, Role.TENANT_ADMIN);
        return TenantResponse.from(governance.createChildTenant(parentId, request.toCreateRequest()));
    }

    @GetMapping
    public List<TenantResponse> list(@RequestParam(required = false) String slug,
                                     FairwaySecurityContext context) {
        guard.requirePlatformAdmin(context);
        List<Tenant> tenants = slug == null
                ? governance.listTenants()
                : governance.findBySlug(slug).map(List::of).orElse(List.of());
        return tenants.stream().map(TenantResponse::from).toList();
    }

    @GetMapping("/{tenantId}")
    public TenantResponse get(@PathVariable String tenantId, FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.VIEWER);
        return TenantResponse.from(governance.get(tenantId));
    }

    @GetMapping("/{tenantId}/children")
    public List<TenantResponse> children(@PathVariable String tenantId, FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.VIEWER);
        return governance.listChildren(tenantId).stream().map(TenantResponse::from).toList();
    }

    @PatchMapping("/{tenantId}")
    public TenantResponse update(@PathVariable String tenantId, @RequestBody UpdateTenantRequest request,
                                 FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.TENANT_ADMIN);
        return TenantResponse.from(
                governance.updateTenant(tenantId, request.name(), request.branding(), request.settings()));
    }

    /** Re-parents a tenant; a missing {@code parentId} makes it a root tenant. */
    @PostMapping("/{tenantId}/transfer")
    public TenantResponse transfer(@PathVariable String tenantId, @RequestBody TransferTenantRequest request,
                                   FairwaySecurityContext context) {
        guard.requirePlatformAdmin(context);
        return TenantResponse.from(governance.transferTenant(tenantId, request.parentId()));
    }

    @GetMapping("/{tenantId}/export")
    public TenantDataExport export(@PathVariable String tenantId, FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.TENANT_ADMIN);
        return governance.exportTenantData(tenantId);
    }

    /** Takes over branding, settings and, for callers allowed to set them, explicit limits. */
    @PostMapping("/{tenantId}/import")
    public TenantResponse importData(@PathVariable String tenantId, @RequestBody TenantDataExport data,
                                     FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.TENANT_ADMIN);
        if (data.limitsOverride() != null) {
            requireLimitsAdmin(governance.get(tenantId), context);
        }
        return TenantResponse.from(governance.importTenantData(tenantId, data));
    }

    // ---- Limits ----

    @GetMapping("/{tenantId}/limits")
    public TenantLimits limits(@PathVariable String tenantId, FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.VIEWER);
        return governance.limits(tenantId);
    }

    @PutMapping("/{tenantId}/limits")
    public TenantLimits configureLimits(@PathVariable String tenantId, @RequestBody TenantLimitsRequest request,
                                        FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.VIEWER);
        requireLimitsAdmin(governance.get(tenantId), context);
        return governance.configureLimits(tenantId, request.applyTo(governance.limits(tenantId)));
    }

    private void requireLimitsAdmin(Tenant tenant, FairwaySecurityContext context) {
        if (tenant.isChild()) {
            guard.require(context, tenant.parentId(), Role.TENANT_ADMIN);
        } else {
            guard.requirePlatformAdmin(context);
        }
    }

    // ---- Lifecycle ----

    @PostMapping("/{tenantId}/activate")
    public TenantResponse activate(@PathVariable String tenantId, FairwaySecurityContext context) {
        guard.requirePlatformAdmin(context);
        return TenantResponse.from(governance.activate(tenantId));
    }

    @PostMapping("/{tenantId}/suspend")
    public TenantResponse suspend(@PathVariable String tenantId, @RequestBody SuspendTenantRequest request,
                                  FairwaySecurityContext context) {
        guard.requirePlatformAdmin(context);
        SuspensionReason reason = request.reason() == null
                ? null
                : SuspensionReason.fromString(request.reason())
                        .orElseThrow(() -> TenantException.invalidRequest(
                                "unknown suspension reason: " + request.reason()));
        return TenantResponse.from(governance.suspend(tenantId, reason));
    }

    @PostMapping("/{tenantId}/reactivate")
    public TenantResponse reactivate(@PathVariable String tenantId, FairwaySecurityContext context) {
        guard.requirePlatformAdmin(context);
        return TenantResponse.from(governance.reactivate(tenantId));
    }

    @PostMapping("/{tenantId}/deactivate")
    public TenantResponse deactivate(@PathVariable String tenantId, FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.TENANT_ADMIN);
        return TenantResponse.from(governance.deactivate(tenantId));
    }

    /**
     * Deletes the tenant. Answers with the data transfer when {@code transferTo} was given, else
     * with 204.
     */
    @DeleteMapping("/{tenantId}")
    public ResponseEntity<MigrationResult> delete(@PathVariable String tenantId,
                                                  @RequestParam(required = false) String transferTo,
                                                  FairwaySecurityContext context) {
        return governance.delete(tenantId, context, transferTo)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    // ---- Usage ----

    @PostMapping("/{tenantId}/usage")
    public TenantUsage recordUsage(@PathVariable String tenantId, @Valid @RequestBody RecordUsageRequest request,
                                   FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.BILLING_ADMIN);
        GovernedResource resource = GovernedResource.fromString(request.resource())
                .orElseThrow(() -> TenantException.invalidRequest("unknown resource: " + request.resource()));
        governance.recordUsage(tenantId, resource, request.amount());
        return governance.usage(tenantId);
    }

    @GetMapping("/{tenantId}/usage")
    public TenantUsage usage(@PathVariable String tenantId, FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.VIEWER);
        return governance.usage(tenantId);
    }

    @GetMapping("/{tenantId}/overage")
    public TenantOverage overage(@PathVariable String tenantId, FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.VIEWER);
        return governance.overage(tenantId);
    }

    /** What the tenant can still hand out to new or growing children, keyed by resource name. */
    @GetMapping("/{tenantId}/remaining")
    public Map<String, Long> remaining(@PathVariable String tenantId, FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.VIEWER);
        return governance.remainingAllocation(tenantId).entrySet().stream()
                .collect(Collectors.toMap(entry -> entry.getKey().value(), Map.Entry::getValue));
    }

    // ---- Health ----

    @GetMapping("/{tenantId}/health")
    public TenantHealthScore health(@PathVariable String tenantId, FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.VIEWER);
        return governance.healthScore(tenantId);
    }

    @GetMapping("/{tenantId}/health/history")
    public List<TenantHealthScore> healthHistory(@PathVariable String tenantId, FairwaySecurityContext context) {
        guard.require(context, tenantId, Role.VIEWER);
        return governance.healthHistory(tenantId);
    }

    @GetMapping("/health")
    public BatchResponse<TenantHealthScore> allHealth(FairwaySecurityContext context) {
        guard.requirePlatformAdmin(context);
        return BatchResponse.from(governance.allTenantsHealth());
    }

    // ---- Migrations ----

    @PostMapping("/migrations")
    public MigrationResult migrate(@Valid @RequestBody MigrationRequest request, FairwaySecurityContext context) {
        guard.requirePlatformAdmin(context);
        return governance.migrate(request.fromTenantId(), request.toTenantId(), request.toOptions());
    }

    @GetMapping("/migrations/{migrationId}")
    public MigrationResult migration(@PathVariable String migrationId, FairwaySecurityContext context) {
        guard.requirePlatformAdmin(context);
        return governance.migration(migrationId);
    }

    @PostMapping("/migrations/{migrationId}/cancel")
    public MigrationResult cancelMigration(@PathVariable String migrationId, FairwaySecurityContext context) {
        guard.requirePlatformAdmin(context);
        return governance.cancelMigration(migrationId);
    }
}
