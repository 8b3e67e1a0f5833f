package com.fairway.revenue.insight;

import com.fairway.revenue.RevenueMath;
import com.fairway.revenue.anomaly.AnomalySeverity;
import com.fairway.revenue.anomaly.RevenueAnomaly;
import com.fairway.revenue.forecast.ForecastScenario;
import com.fairway.revenue.forecast.RevenueForecast;
import com.fairway.revenue.growth.GrowthTrend;
import com.fairway.revenue.growth.RevenueGrowthAnalysis;
import com.fairway.revenue.metrics.RevenueMetrics;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Rule-based insight generation. Each rule inspects one part of an {@link InsightContext} and
 * emits at most one insight; results are ordered by impact, highest first.
 */
public class InsightGenerator {

    public static final Duration INSIGHT_TTL = Duration.ofDays(30);

    static final BigDecimal CHURN_WARNING = new BigDecimal("0.05");
    static final BigDecimal CHURN_HIGH = new BigDecimal("0.10");
    static final BigDecimal REFUND_WARNING = new BigDecimal("0.05");
    static final BigDecimal REFUND_HIGH = new BigDecimal("0.10");
    static final BigDecimal USAGE_SHARE_TARGET = new BigDecimal("0.10");

    public List<RevenueInsight> generate(InsightContext context) {
        List<RevenueInsight> insights = new ArrayList<>();
        churn(context).ifPresent(insights::add);
        refunds(context).ifPresent(insights::add);
        usageOpportunity(context).ifPresent(insights::add);
        growthTrend(context).ifPresent(insights::add);
        anomalies(context).ifPresent(insights::add);
        prediction(context).ifPresent(insights::add);
        insights.sort(Comparator.comparing(RevenueInsight::impact).reversed()
                .thenComparing(RevenueInsight::insightType));
        return insights;
    }

    private Optional<RevenueInsight> churn(InsightContext context) {
        RevenueMetrics metrics = context.metrics();
        if (metrics == null || metrics.churnRate().compareTo(CHURN_WARNING) <= 0) {
            return Optional.empty();
        }
        ImpactLevel impact = metrics.churnRate().compareTo(CHURN_HIGH) > 0 ? ImpactLevel.HIGH : ImpactLevel.MEDIUM;
        BigDecimal atRisk = RevenueMath.money(metrics.monthlyRecurringRevenue().multiply(metrics.churnRate()));
        return Optional.of(insight(context, "churn", "Churn above 5%",
                "Churn reached " + percent(metrics.churnRate()) + " in " + metrics.period().label(),
                InsightType.WARNING, impact,
                "Reach out to members at risk of cancelling and review recent downgrades",
                atRisk, new BigDecimal("0.8")));
    }

    private Optional<RevenueInsight> refunds(InsightContext context) {
        RevenueMetrics metrics = context.metrics();
        if (metrics == null || metrics.totalRevenue().signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal ratio = RevenueMath.ratio(metrics.refunds(), metrics.totalRevenue());
        if (ratio.compareTo(REFUND_WARNING) <= 0) {
            return Optional.empty();
        }
        ImpactLevel impact = ratio.compareTo(REFUND_HIGH) > 0 ? ImpactLevel.HIGH : ImpactLevel.MEDIUM;
        BigDecimal excess = RevenueMath.money(metrics.refunds()
                .subtract(metrics.totalRevenue().multiply(REFUND_WARNING)));
        return Optional.of(insight(context, "refunds", "Refunds above 5% of revenue",
                "Refunds, chargebacks and credits were " + percent(ratio) + " of gross revenue in "
                        + metrics.period().label(),
                InsightType.WARNING, impact,
                "Review refund reasons and cancellation policies for bookings",
                excess, new BigDecimal("0.75")));
    }

    private Optional<RevenueInsight> usageOpportunity(InsightContext context) {
        RevenueMetrics metrics = context.metrics();
        if (metrics == null || metrics.recurringRevenue().signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal share = RevenueMath.ratio(metrics.usageRevenue(), metrics.totalRevenue());
        if (share.compareTo(USAGE_SHARE_TARGET) >= 0) {
            return Optional.empty();
        }
        BigDecimal potential = RevenueMath.money(metrics.totalRevenue().multiply(USAGE_SHARE_TARGET)
                .subtract(metrics.usageRevenue()));
        return Optional.of(insight(context, "usage", "Usage-based revenue is underused",
                "Usage charges make up " + percent(share) + " of gross revenue",
                InsightType.OPPORTUNITY, ImpactLevel.MEDIUM,
                "Offer pay-per-round or add-on packages to subscribers",
                potential, new BigDecimal("0.6")));
    }

    private Optional<RevenueInsight> growthTrend(InsightContext context) {
        RevenueGrowthAnalysis growth = context.growth();
        if (growth == null) {
            return Optional.empty();
        }
        GrowthTrend trend = growth.growthTrend();
        ImpactLevel impact = switch (trend) {
            case DECLINING -> ImpactLevel.HIGH;
            case ACCELERATING, VOLATILE -> ImpactLevel.MEDIUM;
            case STEADY -> ImpactLevel.LOW;
        };
        String recommendation = switch (trend) {
            case ACCELERATING -> "Invest in the channels driving growth";
            case STEADY -> "Look for new revenue streams to lift growth";
            case DECLINING -> "Investigate lost members and falling usage";
            case VOLATILE -> "Smooth revenue with longer billing cycles";
        };
        return Optional.of(insight(context, "growth", "Revenue growth is " + trend.value(),
                "Quarter-over-quarter growth was " + percent(growth.quarterOverQuarterGrowth())
                        + ", projected monthly growth is " + percent(growth.projectedGrowth()),
                InsightType.TREND, impact, recommendation, null, new BigDecimal("0.7")));
    }

    private Optional<RevenueInsight> anomalies(InsightContext context) {
        List<RevenueAnomaly> serious = new ArrayList<>();
        for (RevenueAnomaly anomaly : context.anomalies()) {
            if (anomaly.severity().isAtLeast(AnomalySeverity.HIGH)) {
                serious.add(anomaly);
            }
        }
        if (serious.isEmpty()) {
            return Optional.empty();
        }
        boolean critical = serious.stream().anyMatch(a -> a.severity() == AnomalySeverity.CRITICAL);
        BigDecimal affected = BigDecimal.ZERO;
        for (RevenueAnomaly anomaly : serious) {
            affected = affected.add(anomaly.affectedRevenue().abs());
        }
        return Optional.of(insight(context, "anomalies", serious.size() + " serious revenue anomalies",
                "High or critical anomalies were detected, the latest on " + serious.get(serious.size() - 1).day(),
                InsightType.WARNING, critical ? ImpactLevel.CRITICAL : ImpactLevel.HIGH,
                "Review the anomalies and their recommended actions",
                RevenueMath.money(affected), new BigDecimal("0.9")));
    }

    private Optional<RevenueInsight> prediction(InsightContext context) {
        return context.forecasts().stream()
                .filter(f -> f.scenario() == ForecastScenario.REALISTIC)
                .min(Comparator.comparingInt(RevenueForecast::monthsAhead))
                .map(forecast -> insight(context, "forecast", "Revenue forecast for " + forecast.month(),
                        "Net revenue is expected to reach " + forecast.predictedRevenue() + " (between "
                                + forecast.confidenceInterval().lowerBound() + " and "
                                + forecast.confidenceInterval().upperBound() + ")",
                        InsightType.PREDICTION, ImpactLevel.LOW,
                        "Plan staffing and tee-time inventory for the expected revenue",
                        forecast.predictedRevenue(), forecast.confidenceInterval().confidence()));
    }

    private static RevenueInsight insight(InsightContext context, String rule, String title, String description,
                                          InsightType type, ImpactLevel impact, String recommendation,
                                          BigDecimal potentialValue, BigDecimal confidence) {
        String key = "insight:" + context.tenantId() + ":" + rule + ":" + context.ledgerVersion();
        return new RevenueInsight(
                UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)),
                context.tenantId(),
                title,
                description,
                type,
                impact,
                recommendation,
                potentialValue,
                RevenueMath.rate(confidence),
                context.asOf(),
                context.asOf().plus(INSIGHT_TTL));
    }

    private static String percent(BigDecimal rate) {
        return rate.movePointRight(2).setScale(1, RevenueMath.ROUNDING) + "%";
    }
}
