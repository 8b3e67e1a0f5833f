package com.fairway.tenant.health;

import com.fairway.common.BoundedCall;
import com.fairway.observability.MetricFactory;
import com.fairway.tenant.Tenant;
import com.fairway.tenant.TenantException;
import com.fairway.tenant.limits.GovernedResource;
import com.fairway.tenant.limits.TenantLimitGovernor;
import com.fairway.tenant.limits.TenantLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scores tenant health from service-level observations and limit usage.
 *
 * <p>Factors and weights: uptime 0.4, error rate 0.3 (valued as 1 − rate), usage efficiency 0.2
 * (1 − API calls used / API call limit, clamped to [0, 1], 1 when unbounded) and customer
 * satisfaction 0.1 (rating / 5). Each score is kept in a per-tenant history, which also supplies
 * the previous score for trends.
 */
public class TenantHealthScorer {

    private static final Logger log = LoggerFactory.getLogger(TenantHealthScorer.class);

    public static final String UPTIME = "Uptime";
    public static final String ERROR_RATE = "Error Rate";
    public static final String USAGE_EFFICIENCY = "Usage Efficiency";
    public static final String CUSTOMER_SATISFACTION = "Customer Satisfaction";

    public static final Duration RECALCULATION_INTERVAL = Duration.ofHours(6);
    static final int HISTORY_SIZE = 30;

    private static final BigDecimal UPTIME_WEIGHT = new BigDecimal("0.4");
    private static final BigDecimal ERROR_RATE_WEIGHT = new BigDecimal("0.3");
    private static final BigDecimal USAGE_WEIGHT = new BigDecimal("0.2");
    private static final BigDecimal SATISFACTION_WEIGHT = new BigDecimal("0.1");

    private static final BigDecimal UPTIME_TARGET = new BigDecimal("0.99");
    private static final BigDecimal ERROR_RATE_CEILING = new BigDecimal("0.01");
    private static final BigDecimal API_USAGE_WARNING = new BigDecimal("0.8");
    private static final BigDecimal MAX_RATING = BigDecimal.valueOf(5);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int SCALE = 4;

    private final TenantLimitGovernor governor;
    private final SloFeed sloFeed;
    private final BoundedCall boundedCall;
    private final MetricFactory metrics;
    private final Clock clock;
    private final Map<String, Deque<TenantHealthScore>> history = new ConcurrentHashMap<>();

    public TenantHealthScorer(TenantLimitGovernor governor, SloFeed sloFeed, BoundedCall boundedCall,
                              MetricFactory metrics, Clock clock) {
        this.governor = governor;
        this.sloFeed = sloFeed;
        this.boundedCall = boundedCall;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Computes, records and returns a fresh score.
     *
     * @throws com.fairway.common.FairwayException UPSTREAM when the SLO feed fails or times out
     * @throws TenantException HEALTH_CHECK_FAILED when the feed returns nothing usable
     */
    public TenantHealthScore score(Tenant tenant) {
        SloSnapshot slo = boundedCall.call("slo-feed", () -> sloFeed.fetch(tenant.id()));
        if (slo == null) {
            throw TenantException.healthCheckFailed(tenant.id(),
                    new IllegalStateException("SLO feed returned no observations"));
        }
        TenantLimits limits = governor.resolveLimits(tenant);
        long apiCalls = governor.usageStore().current(tenant.id()).get(GovernedResource.API_CALLS);
        BigDecimal apiUsage = apiUsageRatio(apiCalls, limits.limit(GovernedResource.API_CALLS));

        Instant now = clock.instant();
        TenantHealthScore score = compose(tenant.id(), slo, apiUsage, latest(tenant.id()).orElse(null), now);
        remember(score);
        metrics.tenantSummary("tenant.health.score", "Tenant health score", tenant.id())
                .record(score.score().doubleValue());
        log.info("Tenant {} health score {} ({})", tenant.id(), score.score(), score.grade().value());
        return score;
    }

    /**
     * Builds a score from its inputs without side effects.
     *
     * @param apiUsage API calls used as a fraction of the limit, 0 when unbounded
     * @param previous previous score of the tenant, or null
     */
    static TenantHealthScore compose(String tenantId, SloSnapshot slo, BigDecimal apiUsage,
                                     TenantHealthScore previous, Instant now) {
        BigDecimal efficiency = clamp(BigDecimal.ONE.subtract(apiUsage));
        List<HealthFactor> factors = List.of(
                factor(UPTIME, UPTIME_WEIGHT, slo.uptime()),
                factor(ERROR_RATE, ERROR_RATE_WEIGHT, BigDecimal.ONE.subtract(slo.errorRate())),
                factor(USAGE_EFFICIENCY, USAGE_WEIGHT, efficiency),
                factor(CUSTOMER_SATISFACTION, SATISFACTION_WEIGHT,
                        slo.satisfactionRating().divide(MAX_RATING, SCALE, RoundingMode.HALF_UP)));

        BigDecimal total = factors.stream()
                .map(HealthFactor::contribution)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        List<String> recommendations = new ArrayList<>();
        if (slo.uptime().compareTo(UPTIME_TARGET) < 0) {
            recommendations.add("Improve system reliability: uptime is below 99%");
        }
        if (slo.errorRate().compareTo(ERROR_RATE_CEILING) > 0) {
            recommendations.add("Investigate failing requests: error rate is above 1%");
        }
        if (apiUsage.compareTo(API_USAGE_WARNING) > 0) {
            recommendations.add("Consider a higher tier: API usage is above 80% of the limit");
        }

        return new TenantHealthScore(tenantId, total, HealthGrade.forScore(total), factors, recommendations,
                trends(factors, previous), now, now.plus(RECALCULATION_INTERVAL));
    }

    public Optional<TenantHealthScore> latest(String tenantId) {
        Deque<TenantHealthScore> scores = history.get(tenantId);
        if (scores == null) {
            return Optional.empty();
        }
        synchronized (scores) {
            return Optional.ofNullable(scores.peekLast());
        }
    }

    /** Recorded scores of a tenant, oldest first. */
    public List<TenantHealthScore> history(String tenantId) {
        Deque<TenantHealthScore> scores = history.get(tenantId);
        if (scores == null) {
            return List.of();
        }
        synchronized (scores) {
            return List.copyOf(scores);
        }
    }

    private void remember(TenantHealthScore score) {
        Deque<TenantHealthScore> scores = history.computeIfAbsent(score.tenantId(), id -> new ArrayDeque<>());
        synchronized (scores) {
            scores.addLast(score);
            while (scores.size() > HISTORY_SIZE) {
                scores.removeFirst();
            }
        }
    }

    static BigDecimal apiUsageRatio(long used, long limit) {
        if (limit == TenantLimits.UNBOUNDED) {
            return BigDecimal.ZERO;
        }
        if (limit == 0) {
            return used == 0 ? BigDecimal.ZERO : BigDecimal.ONE;
        }
        return BigDecimal.valueOf(used).divide(BigDecimal.valueOf(limit), SCALE, RoundingMode.HALF_UP);
    }

    private static HealthFactor factor(String name, BigDecimal weight, BigDecimal value) {
        BigDecimal contribution = weight.multiply(value).multiply(HUNDRED).setScale(SCALE, RoundingMode.HALF_UP);
        return new HealthFactor(name, weight, value, contribution);
    }

    private static List<HealthTrend> trends(List<HealthFactor> factors, TenantHealthScore previous) {
        if (previous == null) {
            return List.of();
        }
        List<HealthTrend> trends = new ArrayList<>();
        for (HealthFactor current : factors) {
            previous.factor(current.name()).ifPresent(before -> {
                BigDecimal change = current.value().subtract(before.value());
                trends.add(new HealthTrend(current.name(), HealthTrendDirection.forChange(change), change));
            });
        }
        return trends;
    }

    private static BigDecimal clamp(BigDecimal value) {
        if (value.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return value.min(BigDecimal.ONE);
    }
}
