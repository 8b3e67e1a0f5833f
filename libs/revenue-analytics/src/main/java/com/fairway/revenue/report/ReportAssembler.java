package com.fairway.revenue.report;

import com.fairway.common.BoundedCall;
import com.fairway.eventmodel.DateRange;
import com.fairway.eventmodel.RevenueEvent;
import com.fairway.revenue.RevenueException;
import com.fairway.revenue.RevenueMath;
import com.fairway.revenue.insight.RevenueInsight;
import com.fairway.revenue.metrics.RevenueBreakdown;
import com.fairway.revenue.metrics.RevenueMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Assembles structured reports and exports and hands them to the configured encoders.
 *
 * <p>Encoders are external collaborators: every call goes through {@link BoundedCall}, so a slow
 * or failing encoder surfaces as an UPSTREAM error instead of hanging the caller.
 */
public class ReportAssembler {

    private static final Logger log = LoggerFactory.getLogger(ReportAssembler.class);

    /** Relative changes within this band are reported as stable. */
    static final BigDecimal STABLE_BAND = new BigDecimal("0.01");

    private final List<ReportEncoder> reportEncoders;
    private final List<ExportEncoder> exportEncoders;
    private final BoundedCall boundedCall;

    public ReportAssembler(List<ReportEncoder> reportEncoders, List<ExportEncoder> exportEncoders,
                           BoundedCall boundedCall) {
        this.reportEncoders = List.copyOf(reportEncoders);
        this.exportEncoders = List.copyOf(exportEncoders);
        this.boundedCall = boundedCall;
    }

    /**
     * @throws RevenueException UNSUPPORTED_FORMAT when no encoder handles the format
     */
    public ReportEncoder reportEncoderFor(ReportFormat format) {
        return reportEncoders.stream()
                .filter(encoder -> encoder.supports(format))
                .findFirst()
                .orElseThrow(() -> RevenueException.unsupportedFormat(format.value()));
    }

    /**
     * @throws RevenueException UNSUPPORTED_FORMAT when no encoder handles the format
     */
    public ExportEncoder exportEncoderFor(ExportFormat format) {
        return exportEncoders.stream()
                .filter(encoder -> encoder.supports(format))
                .findFirst()
                .orElseThrow(() -> RevenueException.unsupportedFormat(format.value()));
    }

    /**
     * Builds and encodes a report.
     *
     * @param previous metrics of the period before, or null when there were none
     */
    public RevenueReport assemble(String title, ReportFormat format, Instant generatedAt, RevenueMetrics metrics,
                                  RevenueMetrics previous, RevenueBreakdown breakdown,
                                  List<RevenueInsight> insights) {
        ReportEncoder encoder = reportEncoderFor(format);
        String key = "report:" + metrics.tenantId() + ":" + metrics.period().label() + ":" + format.value()
                + ":" + metrics.ledgerVersion();
        RevenueReport report = new RevenueReport(
                UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)),
                metrics.tenantId(),
                title,
                metrics.period(),
                generatedAt,
                metrics,
                breakdown,
                trends(metrics, previous),
                insights,
                format,
                null);
        EncodedDocument document = boundedCall.call("report-encoder:" + format.value(),
                () -> encoder.encode(report));
        log.info("Generated {} report {} for {} ({} bytes)", format.value(), report.id(),
                metrics.period().label(), document.size());
        return report.withDocument(document);
    }

    public EncodedDocument export(String tenantId, DateRange range, ExportFormat format, List<RevenueEvent> events,
                                  Instant generatedAt) {
        ExportEncoder encoder = exportEncoderFor(format);
        RevenueExport export = new RevenueExport(tenantId, range, format, events, generatedAt);
        EncodedDocument document = boundedCall.call("export-encoder:" + format.value(),
                () -> encoder.encode(export));
        log.info("Exported {} events as {} ({} bytes)", export.eventCount(), format.value(), document.size());
        return document;
    }

    /** Movement of the headline metrics against the previous period; empty without a previous period. */
    static List<RevenueTrend> trends(RevenueMetrics current, RevenueMetrics previous) {
        if (previous == null) {
            return List.of();
        }
        BigDecimal gross = current.totalRevenue();
        List<RevenueTrend> trends = new ArrayList<>();
        trends.add(trend("net_revenue", current, current.netRevenue(), previous.netRevenue(), gross));
        trends.add(trend("recurring_revenue", current, current.recurringRevenue(), previous.recurringRevenue(), gross));
        trends.add(trend("usage_revenue", current, current.usageRevenue(), previous.usageRevenue(), gross));
        trends.add(trend("refunds", current, current.refunds(), previous.refunds(), gross));
        trends.add(trend("customer_count", current, BigDecimal.valueOf(current.customerCount()),
                BigDecimal.valueOf(previous.customerCount()), BigDecimal.valueOf(current.customerCount())));
        return trends;
    }

    private static RevenueTrend trend(String metric, RevenueMetrics current, BigDecimal now, BigDecimal before,
                                      BigDecimal scale) {
        BigDecimal change = now.subtract(before);
        BigDecimal magnitude = before.signum() == 0
                ? RevenueMath.rate(BigDecimal.valueOf(change.signum()))
                : RevenueMath.ratio(change, before.abs());
        TrendDirection direction;
        if (magnitude.abs().compareTo(STABLE_BAND) <= 0) {
            direction = TrendDirection.STABLE;
        } else {
            direction = change.signum() > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
        }
        BigDecimal significance = RevenueMath.clamp(RevenueMath.ratio(change.abs(), scale.abs()),
                BigDecimal.ZERO, BigDecimal.ONE);
        return new RevenueTrend(metric, direction, magnitude, current.period(), RevenueMath.rate(significance));
    }
}
