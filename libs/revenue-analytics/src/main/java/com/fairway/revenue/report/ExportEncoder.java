package com.fairway.revenue.report;

/**
 * Renders raw ledger events into bytes. Implementations live outside the analytics core.
 */
public interface ExportEncoder {

    boolean supports(ExportFormat format);

    EncodedDocument encode(RevenueExport export);
}
