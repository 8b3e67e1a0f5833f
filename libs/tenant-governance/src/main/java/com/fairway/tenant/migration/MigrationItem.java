package com.fairway.tenant.migration;

import java.util.Optional;

/** Kinds of tenant data a migration can move, in the order they are migrated. */
public enum MigrationItem {

    USERS("users"),
    COURSES("courses"),
    BOOKINGS("bookings"),
    SETTINGS("settings");

    private final String value;

    MigrationItem(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<MigrationItem> fromString(String value) {
        for (MigrationItem item : values()) {
            if (item.value.equalsIgnoreCase(value) || item.name().equalsIgnoreCase(value)) {
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }
}
