package com.fairway.tenant;

import java.util.List;
import java.util.Optional;

/**
 * Keyed storage of tenant aggregates.
 */
public interface TenantRepository {

    /** Stores a tenant, replacing any tenant with the same id. */
    void save(Tenant tenant);

    Optional<Tenant> findById(String tenantId);

    Optional<Tenant> findBySlug(String slug);

    /** Direct children of {@code parentId}, in creation order. */
    List<Tenant> findChildren(String parentId);

    /** Every tenant, deleted ones included, in creation order. */
    List<Tenant> findAll();
}
