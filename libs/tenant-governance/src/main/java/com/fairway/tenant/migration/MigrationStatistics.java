package com.fairway.tenant.migration;

/**
 * Item counts of a migration. Items skipped by cancellation count in neither succeeded nor failed.
 */
public record MigrationStatistics(int totalItems, int successfulItems, int failedItems) {

    public static MigrationStatistics empty(int totalItems) {
        return new MigrationStatistics(totalItems, 0, 0);
    }
}
