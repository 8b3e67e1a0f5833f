package com.fairway.tenant.migration;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a migration.
 *
 * @param migratedItems records moved per successful item
 * @param completedAt   null until the migration reaches a terminal status
 */
public record MigrationResult(
        String migrationId,
        String fromTenantId,
        String toTenantId,
        MigrationStatus status,
        Instant startedAt,
        Instant completedAt,
        Map<MigrationItem, Long> migratedItems,
        List<MigrationError> errors,
        MigrationStatistics statistics) {

    public MigrationResult {
        migratedItems = Map.copyOf(migratedItems);
        errors = List.copyOf(errors);
    }
}
