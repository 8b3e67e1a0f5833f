package com.fairway.common.batch;

import com.fairway.common.ErrorKind;

/**
 * Outcome of one item (usually one tenant) inside a batch job.
 *
 * @param key       the item key
 * @param status    pass / fail / cancelled
 * @param value     the computed value; null unless {@code status == SUCCEEDED}
 * @param errorKind failure category; null unless {@code status == FAILED}
 * @param errorCode machine code of the failure; null unless {@code status == FAILED}
 * @param message   human-readable failure or cancellation message; null on success
 * @param <K>       key type
 * @param <T>       value type
 */
public record ItemOutcome<K, T>(
        K key,
        OutcomeStatus status,
        T value,
        ErrorKind errorKind,
        String errorCode,
        String message) {

    public static <K, T> ItemOutcome<K, T> succeeded(K key, T value) {
        return new ItemOutcome<>(key, OutcomeStatus.SUCCEEDED, value, null, null, null);
    }

    public static <K, T> ItemOutcome<K, T> failed(
            K key, ErrorKind kind, String code, String message) {
        return new ItemOutcome<>(key, OutcomeStatus.FAILED, null, kind, code, message);
    }

    public static <K, T> ItemOutcome<K, T> cancelled(K key) {
        return new ItemOutcome<>(
                key, OutcomeStatus.CANCELLED, null, null, null, "batch cancelled before start");
    }

    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCEEDED;
    }
}
