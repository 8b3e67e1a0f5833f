package com.fairway.revenue.report;

import java.util.Optional;

public enum ReportFormat {
    PDF("pdf", "application/pdf"),
    EXCEL("excel", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
    CSV("csv", "text/csv"),
    JSON("json", "application/json"),
    HTML("html", "text/html");

    private final String value;
    private final String contentType;

    ReportFormat(String value, String contentType) {
        this.value = value;
        this.contentType = contentType;
    }

    public String value() {
        return value;
    }

    public String contentType() {
        return contentType;
    }

    public static Optional<ReportFormat> fromString(String value) {
        for (ReportFormat format : values()) {
            if (format.value.equalsIgnoreCase(value)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
