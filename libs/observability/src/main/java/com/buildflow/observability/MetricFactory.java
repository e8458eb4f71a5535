package com.buildflow.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.function.ToDoubleFunction;

/**
 * Creates Micrometer meters that always carry a {@code service} tag.
 * <p>
 * Per-tenant meters add a {@code database} tag through the extra tag pairs. Meters are
 * registered idempotently by Micrometer, so asking twice for the same name and tags returns the
 * same meter.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";
    public static final String TAG_DATABASE = "database";

    private final MeterRegistry registry;
    private final String serviceName;

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

    /**
     * @param tags additional tags as alternating key/value pairs
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge that samples {@code source} on every scrape. Micrometer holds the source
     * weakly, so the caller must keep a reference for as long as the gauge should report.
     */
    public <T> Gauge gauge(String name, String description, T source, ToDoubleFunction<T> value, String... tags) {
        return Gauge.builder(name, source, value)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Removes every meter with the given name and {@code database} tag. Used when a tenant pool
     * is closed so its gauges stop reporting stale values.
     */
    public void removeDatabaseMeters(String name, String database) {
        registry.find(name)
                .tag(TAG_DATABASE, database)
                .meters()
                .forEach(registry::remove);
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
