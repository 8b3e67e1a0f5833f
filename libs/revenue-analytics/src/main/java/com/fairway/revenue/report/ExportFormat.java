package com.fairway.revenue.report;

import java.util.Optional;

public enum ExportFormat {
    CSV("csv", "text/csv"),
    JSON("json", "application/json"),
    EXCEL("excel", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
    XML("xml", "application/xml");

    private final String value;
    private final String contentType;

    ExportFormat(String value, String contentType) {
        this.value = value;
        this.contentType = contentType;
    }

    public String value() {
        return value;
    }

    public String contentType() {
        return contentType;
    }

    public static Optional<ExportFormat> fromString(String value) {
        for (ExportFormat format : values()) {
            if (format.value.equalsIgnoreCase(value)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
