package com.fairway.revenueservice.infrastructure.encoding;

import com.fairway.revenue.report.EncodedDocument;
import com.fairway.revenue.report.ExportEncoder;
import com.fairway.revenue.report.ExportFormat;
import com.fairway.revenue.report.RevenueExport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Renders an event export as a JSON document holding the range and the raw events.
 */
public class JsonExportEncoder implements ExportEncoder {

    private final ObjectMapper mapper;

    public JsonExportEncoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.JSON;
    }

    @Override
    public EncodedDocument encode(RevenueExport export) {
        String owner = export.tenantId() == null ? "platform" : export.tenantId();
        try {
            return new EncodedDocument(ExportFormat.JSON.contentType(), "revenue-events-" + owner + ".json",
                    mapper.writeValueAsBytes(export));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render export for " + owner, e);
        }
    }
}
