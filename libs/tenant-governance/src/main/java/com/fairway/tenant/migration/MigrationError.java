package com.fairway.tenant.migration;

/**
 * @param item    the data kind that failed
 * @param code    machine code of the failure
 * @param message human-readable detail
 */
public record MigrationError(MigrationItem item, String code, String message) {
}
