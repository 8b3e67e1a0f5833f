package com.fairway.tenant;

import java.util.Optional;

public enum SuspensionReason {

    NON_PAYMENT("non_payment"),
    VIOLATION("violation"),
    SECURITY("security"),
    ABUSE("abuse"),
    MAINTENANCE("maintenance"),
    REQUESTED("requested"),
    OTHER("other");

    private final String value;

    SuspensionReason(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<SuspensionReason> fromString(String value) {
        for (SuspensionReason reason : values()) {
            if (reason.value.equalsIgnoreCase(value) || reason.name().equalsIgnoreCase(value)) {
                return Optional.of(reason);
            }
        }
        return Optional.empty();
    }
}
