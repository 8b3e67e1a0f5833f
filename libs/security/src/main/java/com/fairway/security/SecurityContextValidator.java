package com.fairway.security;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a {@link FairwaySecurityContext} built from request headers is complete.
 */
public final class SecurityContextValidator {

    private SecurityContextValidator() {
        // utility class
    }

    /**
     * @return the list of problems, empty when the context is usable
     */
    public static List<String> validate(FairwaySecurityContext context) {
        var errors = new ArrayList<String>();
        if (context.user() == null || isBlank(context.user().userId())) {
            errors.add("user.userId must not be null or blank");
        }
        if (isBlank(context.tenantId())) {
            errors.add("tenantId must not be null or blank");
        }
        if (context.roles().isEmpty()) {
            errors.add("roles must contain at least one role");
        }
        return List.copyOf(errors);
    }

    public static boolean isValid(FairwaySecurityContext context) {
        return validate(context).isEmpty();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
