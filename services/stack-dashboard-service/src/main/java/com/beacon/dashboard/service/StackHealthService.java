package com.beacon.dashboard.service;

import com.beacon.observability.DependencyCheck;
import com.beacon.observability.DependencyClient;
import com.beacon.observability.HealthReport;
import com.beacon.observability.MetricFactory;
import com.beacon.observability.StatusAggregator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Service;

/**
 * Produces health reports for the monitored dependencies and runs on-demand exercises.
 *
 * <p>Every call probes afresh; nothing is cached between requests. The number of unreachable
 * dependencies from the latest report is exported as the {@code beacon.dependencies.unreachable}
 * gauge.
 */
@Service
public class StackHealthService {

    static final String UNREACHABLE_GAUGE = "beacon.dependencies.unreachable";

    private final StatusAggregator aggregator;
    private final MonitoredDependencies dependencies;
    private final AtomicLong unreachable;

    public StackHealthService(
            StatusAggregator aggregator, MonitoredDependencies dependencies, MetricFactory metricFactory) {
        this.aggregator = aggregator;
        this.dependencies = dependencies;
        this.unreachable = metricFactory.gauge(UNREACHABLE_GAUGE, "Dependencies unreachable at the latest check");
    }

    /**
     * Probes every monitored dependency concurrently.
     */
    public HealthReport currentReport() {
        HealthReport report = aggregator.aggregate(dependencies.clients());
        unreachable.set(report.checks().stream().filter(check -> !check.reachable()).count());
        return report;
    }

    /**
     * Runs a single exercise client through the same probe boundary and timeout as the report.
     */
    public DependencyCheck exercise(DependencyClient client) {
        return aggregator.aggregate(List.of(client)).checks().get(0);
    }
}
