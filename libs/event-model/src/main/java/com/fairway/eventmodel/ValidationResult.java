package com.fairway.eventmodel;

import java.util.List;

/**
 * Outcome of a validation pass; all problems are collected rather than failing on the first.
 *
 * @param valid  true when no errors were found
 * @param errors human-readable messages, empty when valid
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, errors);
    }

    /** Errors joined with {@code "; "}, empty when valid. */
    public String summary() {
        return String.join("; ", errors);
    }
}
