package com.fairway.tenant;

import com.fairway.tenant.limits.TenantLimits;

import java.time.Instant;
import java.util.Map;

/**
 * Tenant aggregate root.
 *
 * <p>Status changes go through the transition methods, which enforce {@link TenantStatus}'s
 * state machine and leave the tenant untouched when a transition is rejected. Branding and
 * settings are opaque to governance and stored as given. All methods are synchronized on the
 * instance.
 */
public final class Tenant {

    private final String id;
    private final String slug;
    private final TenantTier tier;
    private final Map<String, String> metadata;
    private final Instant createdAt;

    private String parentId;
    private String name;
    private TenantStatus status;
    private TenantLimits limitsOverride;
    private SuspensionReason suspensionReason;
    private Instant suspendedAt;
    private Map<String, String> branding;
    private Map<String, String> settings;
    private Instant updatedAt;

    /**
     * @param tier           commercial tier; null only for child tenants, which derive from their parent
     * @param parentId       parent tenant, or null for a root tenant
     * @param limitsOverride explicit limits, or null to resolve from tier or parent
     */
    public Tenant(String id, String name, String slug, TenantTier tier, String parentId,
                  TenantLimits limitsOverride, Map<String, String> branding, Map<String, String> settings,
                  Map<String, String> metadata, Instant createdAt) {
        if (id == null || id.isBlank()) {
            throw TenantException.invalidRequest("tenant id is required");
        }
        if (tier == null && parentId == null) {
            throw TenantException.invalidRequest("a root tenant needs a tier");
        }
        this.id = id;
        this.name = name;
        this.slug = slug;
        this.tier = tier;
        this.parentId = parentId;
        this.limitsOverride = limitsOverride;
        this.branding = branding == null ? Map.of() : Map.copyOf(branding);
        this.settings = settings == null ? Map.of() : Map.copyOf(settings);
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.status = TenantStatus.PROVISIONING;
    }

    public String id() {
        return id;
    }

    public String slug() {
        return slug;
    }

    public TenantTier tier() {
        return tier;
    }

    public synchronized String parentId() {
        return parentId;
    }

    public synchronized boolean isChild() {
        return parentId != null;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public synchronized String name() {
        return name;
    }

    public synchronized TenantStatus status() {
        return status;
    }

    public synchronized TenantLimits limitsOverride() {
        return limitsOverride;
    }

    public synchronized SuspensionReason suspensionReason() {
        return suspensionReason;
    }

    public synchronized Instant suspendedAt() {
        return suspendedAt;
    }

    public synchronized Map<String, String> branding() {
        return branding;
    }

    public synchronized Map<String, String> settings() {
        return settings;
    }

    public synchronized Instant updatedAt() {
        return updatedAt;
    }

    public synchronized void activate(Instant now) {
        moveTo(TenantStatus.ACTIVE, now);
    }

    /**
     * @throws TenantException SUSPENSION_REASON_REQUIRED without a reason,
     *                         INVALID_STATUS_TRANSITION unless active
     */
    public synchronized void suspend(SuspensionReason reason, Instant now) {
        if (reason == null) {
            throw TenantException.suspensionReasonRequired(id);
        }
        moveTo(TenantStatus.SUSPENDED, now);
        suspensionReason = reason;
        suspendedAt = now;
    }

    /** Suspended back to active; clears the suspension. */
    public synchronized void reactivate(Instant now) {
        if (status != TenantStatus.SUSPENDED) {
            throw TenantException.invalidTransition(id, status, TenantStatus.ACTIVE);
        }
        moveTo(TenantStatus.ACTIVE, now);
        suspensionReason = null;
        suspendedAt = null;
    }

    public synchronized void deactivate(Instant now) {
        moveTo(TenantStatus.INACTIVE, now);
    }

    public synchronized void markDeleted(Instant now) {
        moveTo(TenantStatus.DELETED, now);
    }

    public synchronized void rename(String newName, Instant now) {
        requireMutable();
        this.name = newName;
        this.updatedAt = now;
    }

    /** Replaces the explicit limits; null removes the override. */
    public synchronized void configureLimits(TenantLimits limits, Instant now) {
        requireMutable();
        this.limitsOverride = limits;
        this.updatedAt = now;
    }

    public synchronized void configureBranding(Map<String, String> newBranding, Instant now) {
        requireMutable();
        this.branding = newBranding == null ? Map.of() : Map.copyOf(newBranding);
        this.updatedAt = now;
    }

    public synchronized void configureSettings(Map<String, String> newSettings, Instant now) {
        requireMutable();
        this.settings = newSettings == null ? Map.of() : Map.copyOf(newSettings);
        this.updatedAt = now;
    }

    /**
     * Moves the tenant under another parent, or to the root when {@code newParentId} is null.
     *
     * @throws TenantException INVALID_REQUEST when the tenant would become its own parent or a
     *                         root without a tier
     */
    public synchronized void reparent(String newParentId, Instant now) {
        requireMutable();
        if (id.equals(newParentId)) {
            throw TenantException.invalidRequest("tenant " + id + " cannot be its own parent");
        }
        if (newParentId == null && tier == null) {
            throw TenantException.invalidRequest("a root tenant needs a tier");
        }
        this.parentId = newParentId;
        this.updatedAt = now;
    }

    private void moveTo(TenantStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw TenantException.invalidTransition(id, status, target);
        }
        status = target;
        updatedAt = now;
    }

    private void requireMutable() {
        if (status.isTerminal()) {
            throw TenantException.invalidTransition(id, status, status);
        }
    }

    @Override
    public String toString() {
        return "Tenant{id=" + id + ", slug=" + slug + ", status=" + status() + "}";
    }
}
