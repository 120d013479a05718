package com.beacon.sysinfo.config;

import com.beacon.observability.DependencyProbe;
import com.beacon.observability.HostMetrics;
import com.beacon.observability.JvmHostMetrics;
import com.beacon.observability.StatusAggregator;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SystemInfoConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HostMetrics hostMetrics() {
        return new JvmHostMetrics();
    }

    /**
     * This service has no dependencies, so one thread is enough.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService probeExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean
    public StatusAggregator statusAggregator(ExecutorService probeExecutor, Clock clock) {
        return new StatusAggregator(
                new DependencyProbe(), probeExecutor, StatusAggregator.DEFAULT_TIMEOUT_MS, clock);
    }
}
