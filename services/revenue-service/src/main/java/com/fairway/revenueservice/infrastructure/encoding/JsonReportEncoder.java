package com.fairway.revenueservice.infrastructure.encoding;

import com.fairway.revenue.report.EncodedDocument;
import com.fairway.revenue.report.ReportEncoder;
import com.fairway.revenue.report.ReportFormat;
import com.fairway.revenue.report.RevenueReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Renders reports as JSON. The report's own {@code document} field is left out of the rendering.
 */
public class JsonReportEncoder implements ReportEncoder {

    private final ObjectMapper mapper;

    public JsonReportEncoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public boolean supports(ReportFormat format) {
        return format == ReportFormat.JSON;
    }

    @Override
    public EncodedDocument encode(RevenueReport report) {
        try {
            byte[] json = mapper.writeValueAsBytes(report.withDocument(null));
            return new EncodedDocument(ReportFormat.JSON.contentType(), "revenue-report-" + report.id() + ".json", json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render report " + report.id(), e);
        }
    }
}
