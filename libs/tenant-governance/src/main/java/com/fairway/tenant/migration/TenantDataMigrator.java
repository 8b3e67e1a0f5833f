package com.fairway.tenant.migration;

/**
 * Moves one kind of data between tenants. Implementations talk to the owning data stores.
 */
public interface TenantDataMigrator {

    /**
     * @return number of records moved
     */
    long migrate(String migrationId, MigrationItem item, String fromTenantId, String toTenantId,
                 boolean preserveIds);
}
