package com.fairway.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Creates Micrometer meters that always carry a {@code service} tag and, where the meter is
 * per tenant, a {@code tenant} tag.
 * <p>
 * Platform-wide measurements (no tenant) are tagged {@value #PLATFORM_TENANT} so that tenant
 * dashboards and platform dashboards query the same meter names.
 */
public final class MetricFactory {

    public static final String TAG_TENANT = "tenant";
    public static final String TAG_SERVICE = "service";

    /** Tag value used when a measurement is not attributable to a single tenant. */
    public static final String PLATFORM_TENANT = "platform";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    backing registry ({@code SimpleMeterRegistry} in tests, Prometheus in the service)
     * @param serviceName logical service name attached to every meter
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(serviceTags(tags))
                .register(registry);
    }

    /**
     * Counter segmented by tenant; {@code tenantId} may be null for platform-wide counts.
     */
    public Counter tenantCounter(String name, String description, String tenantId, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(serviceTags(tags).and(TAG_TENANT, tenantTag(tenantId)))
                .register(registry);
    }

    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(serviceTags(tags))
                .register(registry);
    }

    /**
     * Distribution summary segmented by tenant, e.g. health scores per tenant.
     */
    public DistributionSummary tenantSummary(String name, String description, String tenantId) {
        return DistributionSummary.builder(name)
                .description(description)
                .tags(serviceTags().and(TAG_TENANT, tenantTag(tenantId)))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    /**
     * Maps a nullable tenant id to its tag value.
     */
    public static String tenantTag(String tenantId) {
        return tenantId == null || tenantId.isBlank() ? PLATFORM_TENANT : tenantId;
    }

    private Tags serviceTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
