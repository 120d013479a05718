package com.beacon.dashboard.config;

import com.beacon.observability.CorrelationContext;
import com.beacon.observability.CorrelationContextHolder;
import com.beacon.observability.CounterStore;
import com.beacon.observability.DependencyProbe;
import com.beacon.observability.HostMetrics;
import com.beacon.observability.InMemoryCounterStore;
import com.beacon.observability.JvmHostMetrics;
import com.beacon.observability.MetricFactory;
import com.beacon.observability.MetricsSnapshotter;
import com.beacon.observability.ReportRenderer;
import com.beacon.observability.StatusAggregator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Probing, aggregation, host metrics and counters.
 */
@Configuration
public class ObservabilityConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, DashboardProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public DependencyProbe dependencyProbe() {
        return new DependencyProbe();
    }

    /**
     * Runs dependency probes. Shut down by the context on close.
     */
    @Bean
    public ThreadPoolTaskExecutor probeExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(64);
        executor.setThreadNamePrefix("probe-");
        executor.setTaskDecorator(correlationPropagatingDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    /**
     * The underlying pool still applies the correlation decorator and supports interrupting
     * timed-out checks.
     */
    @Bean
    public StatusAggregator statusAggregator(
            DependencyProbe probe, ThreadPoolTaskExecutor probeExecutor, DashboardProperties properties, Clock clock) {
        return new StatusAggregator(
                probe, probeExecutor.getThreadPoolExecutor(), properties.probeTimeout().toMillis(), clock);
    }

    @Bean
    public HostMetrics hostMetrics() {
        return new JvmHostMetrics();
    }

    @Bean
    public MetricsSnapshotter metricsSnapshotter(HostMetrics hostMetrics, Clock clock) {
        return new MetricsSnapshotter(hostMetrics, clock);
    }

    @Bean
    public ReportRenderer reportRenderer(ObjectMapper objectMapper) {
        return new ReportRenderer(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(
            prefix = "beacon.dashboard",
            name = "counter-store",
            havingValue = DashboardProperties.COUNTER_STORE_MEMORY,
            matchIfMissing = true)
    public CounterStore inMemoryCounterStore(MetricFactory metricFactory) {
        return new InMemoryCounterStore(metricFactory);
    }

    static TaskDecorator correlationPropagatingDecorator() {
        return task -> {
            CorrelationContext context = CorrelationContextHolder.get().orElse(null);
            if (context == null) {
                return task;
            }
            return () -> CorrelationContextHolder.runWithContext(context, task);
        };
    }
}
