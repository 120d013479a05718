package com.beacon.dashboard.api;

import com.beacon.dashboard.config.DashboardProperties;
import com.beacon.dashboard.service.StackHealthService;
import com.beacon.dashboard.service.TrafficCounters;
import com.beacon.dashboard.view.DashboardPage;
import com.beacon.dashboard.view.DashboardView;
import com.beacon.observability.HealthReport;
import com.beacon.observability.HostMetrics;
import com.beacon.observability.MetricsSnapshot;
import com.beacon.observability.MetricsSnapshotter;
import com.beacon.observability.ReportFormat;
import com.beacon.observability.ReportRenderer;
import java.util.concurrent.TimeUnit;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * The HTML dashboard on {@code /}.
 */
@RestController
public class DashboardController {

    private final StackHealthService healthService;
    private final MetricsSnapshotter snapshotter;
    private final TrafficCounters counters;
    private final HostMetrics hostMetrics;
    private final ReportRenderer renderer;
    private final DashboardPage page;
    private final DashboardProperties properties;

    public DashboardController(
            StackHealthService healthService,
            MetricsSnapshotter snapshotter,
            TrafficCounters counters,
            HostMetrics hostMetrics,
            ReportRenderer renderer,
            DashboardPage page,
            DashboardProperties properties) {
        this.healthService = healthService;
        this.snapshotter = snapshotter;
        this.counters = counters;
        this.hostMetrics = hostMetrics;
        this.renderer = renderer;
        this.page = page;
        this.properties = properties;
    }

    @GetMapping(path = "/", produces = MediaType.TEXT_HTML_VALUE)
    public String dashboard() {
        long started = System.nanoTime();
        counters.recordDashboardView();
        HealthReport report = healthService.currentReport();
        MetricsSnapshot snapshot = snapshotter.snapshot(counters.store());
        String summary = renderer.render(report, ReportFormat.HUMAN);
        long renderTimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        return page.render(new DashboardView(
                hostMetrics.hostname(),
                properties.environment(),
                properties.version(),
                hostMetrics.runtimeVersion(),
                hostMetrics.uptime(),
                report,
                snapshot,
                summary,
                renderTimeMs));
    }
}
