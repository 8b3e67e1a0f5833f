package com.fairway.revenue;

import com.fairway.common.ErrorKind;
import com.fairway.common.FairwayException;
import com.fairway.eventmodel.DateRange;

import java.util.UUID;

/**
 * Failure raised by revenue analytics operations. Use the static factories so that each failure
 * gets the right {@link ErrorKind} and code.
 */
public class RevenueException extends FairwayException {

    public static final String INVALID_PERIOD = "INVALID_PERIOD";
    public static final String INVALID_DATE_RANGE = "INVALID_DATE_RANGE";
    public static final String INVALID_EVENT = "INVALID_EVENT";
    public static final String DUPLICATE_EVENT = "DUPLICATE_EVENT";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String UNSUPPORTED_FORMAT = "UNSUPPORTED_FORMAT";
    public static final String TENANT_NOT_FOUND = "TENANT_NOT_FOUND";
    public static final String INSUFFICIENT_DATA = "INSUFFICIENT_DATA";
    public static final String CALCULATION_ERROR = "CALCULATION_ERROR";
    public static final String FORECAST_FAILED = "FORECAST_FAILED";
    public static final String ANOMALY_DETECTION_FAILED = "ANOMALY_DETECTION_FAILED";

    public RevenueException(ErrorKind kind, String code, String message) {
        super(kind, code, message);
    }

    public RevenueException(ErrorKind kind, String code, String message, Throwable cause) {
        super(kind, code, message, cause);
    }

    public static RevenueException invalidPeriod(String detail) {
        return new RevenueException(ErrorKind.VALIDATION, INVALID_PERIOD,
                "Invalid revenue period: " + detail);
    }

    public static RevenueException invalidDateRange(DateRange range) {
        return new RevenueException(ErrorKind.VALIDATION, INVALID_DATE_RANGE,
                "Invalid date range: start " + range.start() + " is after end " + range.end());
    }

    public static RevenueException invalidEvent(String detail) {
        return new RevenueException(ErrorKind.VALIDATION, INVALID_EVENT,
                "Invalid revenue event: " + detail);
    }

    public static RevenueException duplicateEvent(UUID id) {
        return new RevenueException(ErrorKind.VALIDATION, DUPLICATE_EVENT,
                "Revenue event " + id + " has already been recorded");
    }

    public static RevenueException invalidRequest(String detail) {
        return new RevenueException(ErrorKind.VALIDATION, INVALID_REQUEST, detail);
    }

    public static RevenueException unsupportedFormat(String format) {
        return new RevenueException(ErrorKind.VALIDATION, UNSUPPORTED_FORMAT,
                "No encoder is registered for format " + format);
    }

    public static RevenueException tenantNotFound(String tenantId) {
        return new RevenueException(ErrorKind.NOT_FOUND, TENANT_NOT_FOUND,
                "Tenant with ID " + tenantId + " not found");
    }

    public static RevenueException insufficientData(String detail) {
        return new RevenueException(ErrorKind.COMPUTATION, INSUFFICIENT_DATA,
                "Insufficient data for revenue calculation: " + detail);
    }

    public static RevenueException calculationError(String detail) {
        return new RevenueException(ErrorKind.COMPUTATION, CALCULATION_ERROR,
                "Revenue calculation failed: " + detail);
    }

    public static RevenueException forecastFailed(String detail) {
        return new RevenueException(ErrorKind.COMPUTATION, FORECAST_FAILED,
                "Revenue forecast failed: " + detail);
    }

    public static RevenueException anomalyDetectionFailed(String detail, Throwable cause) {
        return new RevenueException(ErrorKind.COMPUTATION, ANOMALY_DETECTION_FAILED,
                "Anomaly detection failed: " + detail, cause);
    }
}
