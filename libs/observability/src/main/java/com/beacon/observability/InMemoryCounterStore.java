package com.beacon.observability;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process {@link CounterStore} backed by one {@link AtomicLong} per counter.
 * <p>
 * Values live for the lifetime of the process. When built with a {@link MetricFactory}, each
 * counter is also exported to Micrometer.
 */
public final class InMemoryCounterStore implements CounterStore {

    private final Map<CounterName, AtomicLong> counters = new EnumMap<>(CounterName.class);

    /**
     * Creates a store that is not exported to any meter registry.
     */
    public InMemoryCounterStore() {
        for (CounterName name : CounterName.values()) {
            counters.put(name, new AtomicLong());
        }
    }

    /**
     * Creates a store and exports every counter through the given factory.
     *
     * @param metrics factory used to register one function counter per {@link CounterName}
     */
    public InMemoryCounterStore(MetricFactory metrics) {
        this();
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        counters.forEach((name, value) ->
                metrics.functionCounter(name.meterName(), name.description(), value, AtomicLong::doubleValue));
    }

    @Override
    public long increment(CounterName counter) {
        return counters.get(counter).incrementAndGet();
    }

    @Override
    public long get(CounterName counter) {
        return counters.get(counter).get();
    }
}
