package com.fairway.common;

import java.util.Objects;

/**
 * Base type for every failure surfaced by the Fairway core.
 *
 * <p>Unchecked, so that operations can be composed without {@code throws} clutter. Each
 * exception carries an {@link ErrorKind} for coarse routing and a stable upper-snake-case {@code
 * code} (e.g. {@code TENANT_NOT_FOUND}) for precise handling.
 */
public class FairwayException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;

    public FairwayException(ErrorKind kind, String code, String message) {
        this(kind, code, message, null);
    }

    public FairwayException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.code = Objects.requireNonNull(code, "code");
    }

    /** The coarse failure category. */
    public ErrorKind kind() {
        return kind;
    }

    /** The stable machine code, e.g. {@code INVALID_DATE_RANGE}. */
    public String code() {
        return code;
    }
}
