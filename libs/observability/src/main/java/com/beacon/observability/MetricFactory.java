package com.beacon.observability;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToDoubleFunction;

/**
 * Factory for Micrometer meters carrying a {@code service} tag.
 * <p>
 * Counters owned by a {@link CounterStore} are exported as function counters that read the
 * store's own value, so the registry never holds a second copy of the count.
 */
public final class MetricFactory {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates a MetricFactory bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param serviceName logical service name included as a default tag
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

    /**
     * Registers a monotonic function counter backed by {@code source}.
     *
     * @param name        metric name (e.g., "beacon.requests.total")
     * @param description human-readable description
     * @param source      object holding the count
     * @param reader      reads the current count from {@code source}
     * @param tags        additional tags (key-value pairs)
     * @return the function counter
     */
    public <T> FunctionCounter functionCounter(
            String name, String description, T source, ToDoubleFunction<T> reader, String... tags) {
        return FunctionCounter.builder(name, source, reader)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge with service tag.
     *
     * @param name        metric name (e.g., "beacon.dependencies.unreachable")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return an AtomicLong that can be used to update the gauge value
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        AtomicLong value = new AtomicLong(0);
        Gauge.builder(name, value, AtomicLong::doubleValue)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
        return value;
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the service name used as a default tag.
     */
    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
