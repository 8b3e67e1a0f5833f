package com.fairway.security;

import com.fairway.common.ErrorKind;
import com.fairway.common.FairwayException;

/**
 * Raised when the caller may not see or change a resource.
 *
 * <p>The public message is always the same so that a denied request cannot reveal
 * whether another tenant's resource exists. The detail goes to logs only.
 */
public class AccessDeniedException extends FairwayException {

    public static final String CODE = "ACCESS_DENIED";

    private final String detail;

    public AccessDeniedException(String detail) {
        super(ErrorKind.AUTHORIZATION, CODE, "Access denied");
        this.detail = detail;
    }

    /** Internal reason, for logging; never returned to callers. */
    public String detail() {
        return detail;
    }
}
