package com.fairway.tenant.limits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link UsageCounterStore} holding one set of atomic counters per tenant. Counters start over
 * when the UTC calendar month changes.
 */
public class InMemoryUsageCounterStore implements UsageCounterStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryUsageCounterStore.class);

    private final Clock clock;
    private final Map<String, Counters> counters = new ConcurrentHashMap<>();

    public InMemoryUsageCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long increment(String tenantId, GovernedResource resource, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must not be negative");
        }
        return countersFor(tenantId).get(resource).addAndGet(amount);
    }

    @Override
    public void set(String tenantId, GovernedResource resource, long value) {
        if (value < 0) {
            throw new IllegalArgumentException("value must not be negative");
        }
        countersFor(tenantId).get(resource).set(value);
    }

    @Override
    public TenantUsage current(String tenantId) {
        YearMonth period = currentPeriod();
        Counters existing = counters.get(tenantId);
        if (existing == null || !existing.period.equals(period)) {
            return TenantUsage.empty(tenantId, period);
        }
        EnumMap<GovernedResource, Long> values = new EnumMap<>(GovernedResource.class);
        existing.values.forEach((resource, value) -> values.put(resource, value.get()));
        return new TenantUsage(tenantId, period, values);
    }

    private Map<GovernedResource, AtomicLong> countersFor(String tenantId) {
        YearMonth period = currentPeriod();
        return counters.compute(tenantId, (id, existing) -> {
            if (existing != null && existing.period.equals(period)) {
                return existing;
            }
            if (existing != null) {
                log.info("Starting billing period {} for tenant {}", period, id);
            }
            return new Counters(period);
        }).values;
    }

    private YearMonth currentPeriod() {
        return YearMonth.from(clock.instant().atZone(ZoneOffset.UTC));
    }

    private static final class Counters {

        private final YearMonth period;
        private final Map<GovernedResource, AtomicLong> values = new EnumMap<>(GovernedResource.class);

        private Counters(YearMonth period) {
            this.period = period;
            for (GovernedResource resource : GovernedResource.values()) {
                values.put(resource, new AtomicLong());
            }
        }
    }
}
