package com.beacon.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link MetricFactory}: service tagging for function counters and gauges.
 */
@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "test-service");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank service name")
        void shouldRejectBlankServiceName() {
            assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }

        @Test
        @DisplayName("should expose registry and service name")
        void shouldExposeRegistryAndServiceName() {
            assertThat(factory.registry()).isSameAs(registry);
            assertThat(factory.serviceName()).isEqualTo("test-service");
        }
    }

    @Test
    @DisplayName("function counter reads the backing value with service and extra tags")
    void shouldCreateFunctionCounter() {
        AtomicLong source = new AtomicLong(5);

        FunctionCounter counter =
                factory.functionCounter("jobs.done", "Jobs done", source, AtomicLong::doubleValue, "kind", "batch");
        source.addAndGet(3);

        assertThat(counter.count()).isEqualTo(8.0);
        assertThat(counter.getId().getTag("service")).isEqualTo("test-service");
        assertThat(counter.getId().getTag("kind")).isEqualTo("batch");
    }

    @Test
    @DisplayName("gauge follows updates of the returned AtomicLong")
    void shouldUpdateGauge() {
        AtomicLong value = factory.gauge("dependencies.unreachable", "Unreachable dependencies");

        value.set(2);
        assertThat(registry.get("dependencies.unreachable").tag("service", "test-service").gauge().value())
                .isEqualTo(2.0);

        value.set(0);
        assertThat(registry.get("dependencies.unreachable").gauge().value()).isZero();
    }
}
