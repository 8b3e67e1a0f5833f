package com.fairway.revenue.report;

import com.fairway.revenue.insight.RevenueInsight;
import com.fairway.revenue.metrics.RevenueBreakdown;
import com.fairway.revenue.metrics.RevenueMetrics;
import com.fairway.revenue.period.RevenuePeriod;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Structured revenue report. {@code document} holds the encoder's rendering and is null until the
 * report has been encoded.
 */
public record RevenueReport(
        UUID id,
        String tenantId,
        String title,
        RevenuePeriod period,
        Instant generatedAt,
        RevenueMetrics metrics,
        RevenueBreakdown breakdown,
        List<RevenueTrend> trends,
        List<RevenueInsight> insights,
        ReportFormat format,
        EncodedDocument document) {

    public RevenueReport {
        trends = List.copyOf(trends);
        insights = List.copyOf(insights);
    }

    public RevenueReport withDocument(EncodedDocument encoded) {
        return new RevenueReport(id, tenantId, title, period, generatedAt, metrics, breakdown, trends,
                insights, format, encoded);
    }
}
