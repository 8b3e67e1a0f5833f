package com.fairway.tenant.migration;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

public enum MigrationStatus {

    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    PARTIALLY_COMPLETED("partially_completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    MigrationStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public Set<MigrationStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(IN_PROGRESS, CANCELLED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, PARTIALLY_COMPLETED, FAILED, CANCELLED);
            case COMPLETED, PARTIALLY_COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(MigrationStatus.class);
        };
    }

    public boolean canTransitionTo(MigrationStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    public static Optional<MigrationStatus> fromString(String value) {
        for (MigrationStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
