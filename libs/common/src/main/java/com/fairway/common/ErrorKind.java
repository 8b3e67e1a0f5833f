package com.fairway.common;

/**
 * Machine-distinguishable failure categories shared by every Fairway library.
 *
 * <p>Callers branch on the kind, never on message text. The REST layer maps each kind to one HTTP
 * status.
 */
public enum ErrorKind {

    /** Malformed input rejected before any state change. Never retried automatically. */
    VALIDATION,

    /** A referenced resource (tenant, domain, migration) does not exist. */
    NOT_FOUND,

    /** The caller lacks permission. Messages never reveal whether the resource exists. */
    AUTHORIZATION,

    /** A derivation could not be produced (insufficient data, forecast or detection failure). */
    COMPUTATION,

    /** An external collaborator failed or timed out. The original cause is preserved. */
    UPSTREAM
}
