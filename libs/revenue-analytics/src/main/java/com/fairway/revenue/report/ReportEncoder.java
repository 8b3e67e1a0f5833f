package com.fairway.revenue.report;

/**
 * Renders a structured report into bytes. Implementations live outside the analytics core.
 */
public interface ReportEncoder {

    boolean supports(ReportFormat format);

    EncodedDocument encode(RevenueReport report);
}
