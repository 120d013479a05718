package com.beacon.observability;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probes a list of dependencies concurrently and folds the outcomes into one {@link HealthReport}.
 * <p>
 * Each dependency gets its own {@link DependencyProbe} run on the supplied executor. Results are
 * collected in declaration order, never completion order. A probe that exceeds the timeout, or
 * whose task fails, is reported as unreachable without affecting the others. Timed-out checks are
 * cancelled with an interrupt so they do not keep holding executor threads. The overall status
 * is {@link HealthStatus#DEGRADED} as soon as one dependency is unreachable.
 */
public final class StatusAggregator {

    private static final Logger log = LoggerFactory.getLogger(StatusAggregator.class);

    /** Default timeout for an individual probe (5 seconds). */
    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private final DependencyProbe probe;
    private final ExecutorService executor;
    private final long timeoutMs;
    private final Clock clock;

    /**
     * Creates an aggregator.
     *
     * @param probe     probe used for every dependency
     * @param executor  executor running the probes
     * @param timeoutMs timeout in milliseconds for each individual probe
     * @param clock     clock supplying the report timestamp
     */
    public StatusAggregator(DependencyProbe probe, ExecutorService executor, long timeoutMs, Clock clock) {
        if (probe == null) {
            throw new IllegalArgumentException("probe must not be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.probe = probe;
        this.executor = executor;
        this.timeoutMs = timeoutMs;
        this.clock = clock;
    }

    /**
     * Probes every dependency and aggregates the results.
     * <p>
     * Returns {@link HealthStatus#HEALTHY} with no checks when the list is empty.
     *
     * @param dependencies dependencies in declaration order; names must be unique
     * @return the aggregate report
     */
    public HealthReport aggregate(List<? extends DependencyClient> dependencies) {
        if (dependencies == null) {
            throw new IllegalArgumentException("dependencies must not be null");
        }
        requireUniqueNames(dependencies);
        if (dependencies.isEmpty()) {
            return HealthReport.of(List.of(), clock.instant());
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        List<Future<DependencyCheck>> futures = new ArrayList<>(dependencies.size());
        for (DependencyClient dependency : dependencies) {
            futures.add(submit(dependency));
        }

        List<DependencyCheck> checks = new ArrayList<>(dependencies.size());
        for (int i = 0; i < dependencies.size(); i++) {
            String name = dependencies.get(i).name();
            checks.add(await(name, futures.get(i), deadline));
        }

        HealthReport report = HealthReport.of(checks, clock.instant());
        if (!report.isHealthy()) {
            log.info("Health report {} ({} of {} dependencies unreachable)",
                    report.overallStatus(),
                    checks.stream().filter(c -> !c.reachable()).count(),
                    checks.size());
        }
        return report;
    }

    private Future<DependencyCheck> submit(DependencyClient dependency) {
        try {
            return executor.submit(() -> probe.probe(dependency));
        } catch (RejectedExecutionException e) {
            log.warn("Probe of {} rejected by executor", dependency.name());
            return CompletableFuture.completedFuture(
                    DependencyCheck.unreachable(dependency.name(), "Probe rejected: executor unavailable"));
        }
    }

    private DependencyCheck await(String name, Future<DependencyCheck> future, long deadline) {
        try {
            return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Probe of {} timed out after {}ms", name, timeoutMs);
            return DependencyCheck.unreachable(name, "Timed out after " + timeoutMs + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return DependencyCheck.unreachable(name, "Probe interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Probe of {} failed", name, cause);
            return DependencyCheck.unreachable(name, DependencyProbe.describe(cause));
        } catch (CancellationException e) {
            return DependencyCheck.unreachable(name, "Probe cancelled");
        }
    }

    private static void requireUniqueNames(List<? extends DependencyClient> dependencies) {
        Set<String> seen = new HashSet<>();
        for (DependencyClient dependency : dependencies) {
            if (dependency == null) {
                throw new IllegalArgumentException("dependencies must not contain null");
            }
            if (!seen.add(dependency.name())) {
                throw new IllegalArgumentException("duplicate dependency name: " + dependency.name());
            }
        }
    }

    /**
     * Returns the configured per-probe timeout in milliseconds.
     */
    public long timeoutMs() {
        return timeoutMs;
    }
}
