package com.fairway.security;

/**
 * The caller, as established by the authentication layer in front of the service.
 *
 * @param userId      stable user id
 * @param email       contact address, may be null for service accounts
 * @param displayName human-readable name, may be null
 */
public record AuthenticatedUser(
        String userId,
        String email,
        String displayName
) {

    /** A service account acting on behalf of the platform. */
    public static AuthenticatedUser system(String name) {
        return new AuthenticatedUser("system:" + name, null, name);
    }
}
