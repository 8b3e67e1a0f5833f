package com.fairway.observability;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Masks sensitive values in event metadata before it is written to the audit log.
 * <p>
 * A key is sensitive when it contains one of the configured fragments, case-insensitively.
 * The defaults cover payment instruments and personal contact data.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_FRAGMENTS = Set.of(
            "card", "cvv", "iban", "account", "token", "secret",
            "password", "email", "phone"
    );

    private final Set<String> fragments;
    private final Pattern pattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_FRAGMENTS);
    }

    /**
     * @param fragments key fragments treated as sensitive; must not be empty
     */
    public SensitiveDataRedactor(Set<String> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new IllegalArgumentException("fragments must not be empty");
        }
        this.fragments = Set.copyOf(fragments);
        String regex = String.join("|", this.fragments.stream().map(Pattern::quote).sorted().toList());
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a sorted copy of {@code metadata} with sensitive values replaced by
     * {@value #REDACTED}. A null map yields an empty map.
     */
    public Map<String, String> redact(Map<String, String> metadata) {
        Map<String, String> result = new TreeMap<>();
        if (metadata == null) {
            return result;
        }
        metadata.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : value));
        return result;
    }

    public boolean isSensitive(String key) {
        return key != null && pattern.matcher(key).find();
    }

    public Set<String> fragments() {
        return fragments;
    }
}
