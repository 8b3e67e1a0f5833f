package com.fairway.tenant;

import com.fairway.common.ErrorKind;
import com.fairway.common.FairwayException;

/**
 * Failures of tenant governance operations. Codes are stable and upper-snake-case.
 */
public class TenantException extends FairwayException {

    public static final String TENANT_NOT_FOUND = "TENANT_NOT_FOUND";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String SLUG_ALREADY_EXISTS = "SLUG_ALREADY_EXISTS";
    public static final String INVALID_STATUS_TRANSITION = "INVALID_STATUS_TRANSITION";
    public static final String SUSPENSION_REASON_REQUIRED = "SUSPENSION_REASON_REQUIRED";
    public static final String TENANT_NOT_ACTIVE = "TENANT_NOT_ACTIVE";
    public static final String DELETION_NOT_ALLOWED = "DELETION_NOT_ALLOWED";
    public static final String CHILD_TENANTS_NOT_ALLOWED = "CHILD_TENANTS_NOT_ALLOWED";
    public static final String CHILD_TENANT_LIMIT_REACHED = "CHILD_TENANT_LIMIT_REACHED";
    public static final String HIERARCHY_LIMIT_EXCEEDED = "HIERARCHY_LIMIT_EXCEEDED";
    public static final String MIGRATION_NOT_FOUND = "MIGRATION_NOT_FOUND";
    public static final String INVALID_MIGRATION_TRANSITION = "INVALID_MIGRATION_TRANSITION";
    public static final String HEALTH_CHECK_FAILED = "HEALTH_CHECK_FAILED";
    public static final String DATA_TRANSFER_INCOMPLETE = "DATA_TRANSFER_INCOMPLETE";
    public static final String HIERARCHY_CYCLE = "HIERARCHY_CYCLE";

    public TenantException(ErrorKind kind, String code, String message) {
        super(kind, code, message);
    }

    public TenantException(ErrorKind kind, String code, String message, Throwable cause) {
        super(kind, code, message, cause);
    }

    public static TenantException notFound(String tenantId) {
        return new TenantException(ErrorKind.NOT_FOUND, TENANT_NOT_FOUND,
                "Tenant with ID " + tenantId + " not found");
    }

    public static TenantException invalidRequest(String detail) {
        return new TenantException(ErrorKind.VALIDATION, INVALID_REQUEST, detail);
    }

    public static TenantException slugAlreadyExists(String slug) {
        return new TenantException(ErrorKind.VALIDATION, SLUG_ALREADY_EXISTS,
                "Tenant slug '" + slug + "' is already taken");
    }

    public static TenantException invalidTransition(String tenantId, TenantStatus from, TenantStatus to) {
        return new TenantException(ErrorKind.VALIDATION, INVALID_STATUS_TRANSITION,
                "Tenant " + tenantId + " cannot move from " + from.value() + " to " + to.value());
    }

    public static TenantException suspensionReasonRequired(String tenantId) {
        return new TenantException(ErrorKind.VALIDATION, SUSPENSION_REASON_REQUIRED,
                "Suspending tenant " + tenantId + " requires a suspension reason");
    }

    public static TenantException notActive(String tenantId) {
        return new TenantException(ErrorKind.VALIDATION, TENANT_NOT_ACTIVE,
                "Tenant " + tenantId + " is not active");
    }

    public static TenantException deletionNotAllowed(String detail) {
        return new TenantException(ErrorKind.VALIDATION, DELETION_NOT_ALLOWED, detail);
    }

    public static TenantException childTenantsNotAllowed(String parentId) {
        return new TenantException(ErrorKind.VALIDATION, CHILD_TENANTS_NOT_ALLOWED,
                "Tenant " + parentId + " may not have child tenants");
    }

    public static TenantException childTenantLimitReached(String parentId, long limit) {
        return new TenantException(ErrorKind.VALIDATION, CHILD_TENANT_LIMIT_REACHED,
                "Tenant " + parentId + " already has the maximum of " + limit + " child tenants");
    }

    public static TenantException hierarchyLimitExceeded(String parentId, String resource, long requested,
                                                         long remaining) {
        return new TenantException(ErrorKind.VALIDATION, HIERARCHY_LIMIT_EXCEEDED,
                "Child limit " + requested + " for " + resource + " exceeds the " + remaining
                        + " remaining in parent tenant " + parentId);
    }

    public static TenantException migrationNotFound(String migrationId) {
        return new TenantException(ErrorKind.NOT_FOUND, MIGRATION_NOT_FOUND,
                "Migration with ID " + migrationId + " not found");
    }

    public static TenantException invalidMigrationTransition(String migrationId, String from, String to) {
        return new TenantException(ErrorKind.VALIDATION, INVALID_MIGRATION_TRANSITION,
                "Migration " + migrationId + " cannot move from " + from + " to " + to);
    }

    public static TenantException healthCheckFailed(String tenantId, Throwable cause) {
        return new TenantException(ErrorKind.COMPUTATION, HEALTH_CHECK_FAILED,
                "Health score for tenant " + tenantId + " could not be computed: " + cause.getMessage(), cause);
    }

    public static TenantException transferIncomplete(String tenantId, String migrationId, String status) {
        return new TenantException(ErrorKind.UPSTREAM, DATA_TRANSFER_INCOMPLETE,
                "Tenant " + tenantId + " was not deleted: data transfer " + migrationId + " ended " + status);
    }

    public static TenantException hierarchyCycle(String tenantId, String newParentId) {
        return new TenantException(ErrorKind.VALIDATION, HIERARCHY_CYCLE,
                "Tenant " + newParentId + " is below tenant " + tenantId + " and cannot become its parent");
    }
}
