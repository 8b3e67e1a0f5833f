package com.fairway.tenant;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TenantRepository} backed by a concurrent map. Slugs are unique among all tenants.
 */
public class InMemoryTenantRepository implements TenantRepository {

    private static final Comparator<Tenant> CREATION_ORDER =
            Comparator.comparing(Tenant::createdAt).thenComparing(Tenant::id);

    private final Map<String, Tenant> tenants = new ConcurrentHashMap<>();
    private final Map<String, String> idsBySlug = new ConcurrentHashMap<>();

    @Override
    public synchronized void save(Tenant tenant) {
        String owner = idsBySlug.get(tenant.slug());
        if (owner != null && !owner.equals(tenant.id())) {
            throw TenantException.slugAlreadyExists(tenant.slug());
        }
        tenants.put(tenant.id(), tenant);
        idsBySlug.put(tenant.slug(), tenant.id());
    }

    @Override
    public Optional<Tenant> findById(String tenantId) {
        return tenantId == null ? Optional.empty() : Optional.ofNullable(tenants.get(tenantId));
    }

    @Override
    public Optional<Tenant> findBySlug(String slug) {
        return slug == null ? Optional.empty() : Optional.ofNullable(idsBySlug.get(slug)).map(tenants::get);
    }

    @Override
    public List<Tenant> findChildren(String parentId) {
        return tenants.values().stream()
                .filter(tenant -> parentId.equals(tenant.parentId()))
                .sorted(CREATION_ORDER)
                .toList();
    }

    @Override
    public List<Tenant> findAll() {
        return tenants.values().stream().sorted(CREATION_ORDER).toList();
    }
}
