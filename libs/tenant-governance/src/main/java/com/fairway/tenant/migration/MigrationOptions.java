package com.fairway.tenant.migration;

import java.util.EnumSet;
import java.util.Set;

/**
 * What a migration moves.
 *
 * @param items       data kinds to migrate; must not be empty
 * @param preserveIds keep source identifiers in the target tenant
 */
public record MigrationOptions(Set<MigrationItem> items, boolean preserveIds) {

    public MigrationOptions {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("at least one migration item is required");
        }
        items = Set.copyOf(items);
    }

    /** Users, courses and bookings; settings stay with the source tenant. */
    public static MigrationOptions dataTransfer() {
        return new MigrationOptions(EnumSet.of(MigrationItem.USERS, MigrationItem.COURSES, MigrationItem.BOOKINGS),
                false);
    }

    public static MigrationOptions fullMigration() {
        return new MigrationOptions(EnumSet.allOf(MigrationItem.class), true);
    }

    public boolean includes(MigrationItem item) {
        return items.contains(item);
    }
}
