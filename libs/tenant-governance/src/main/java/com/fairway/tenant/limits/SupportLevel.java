package com.fairway.tenant.limits;

import java.util.Optional;

public enum SupportLevel {

    EMAIL("email"),
    PRIORITY("priority"),
    DEDICATED("dedicated");

    private final String value;

    SupportLevel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<SupportLevel> fromString(String value) {
        for (SupportLevel level : values()) {
            if (level.value.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
