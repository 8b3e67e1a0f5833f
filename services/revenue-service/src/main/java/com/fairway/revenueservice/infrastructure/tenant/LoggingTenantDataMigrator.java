package com.fairway.revenueservice.infrastructure.tenant;

import com.fairway.tenant.migration.MigrationItem;
import com.fairway.tenant.migration.TenantDataMigrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Migrator used while no tenant data store is attached to this service: records the request and
 * moves nothing.
 */
public class LoggingTenantDataMigrator implements TenantDataMigrator {

    private static final Logger log = LoggerFactory.getLogger(LoggingTenantDataMigrator.class);

    @Override
    public long migrate(String migrationId, MigrationItem item, String fromTenantId, String toTenantId,
                        boolean preserveIds) {
        log.info("Migration {}: {} from {} to {} (preserveIds={}), no data store attached",
                migrationId, item.value(), fromTenantId, toTenantId, preserveIds);
        return 0;
    }
}
