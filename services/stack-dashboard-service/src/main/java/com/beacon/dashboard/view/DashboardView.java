package com.beacon.dashboard.view;

import com.beacon.observability.HealthReport;
import com.beacon.observability.MetricsSnapshot;
import java.time.Duration;

/**
 * Everything the dashboard page shows for one view.
 *
 * @param hostname       host or container id serving the page
 * @param environment    environment label
 * @param version        version label
 * @param runtimeVersion Java runtime version
 * @param uptime         process uptime
 * @param report         fresh health report
 * @param snapshot       metrics snapshot taken for this view
 * @param summary        human-readable rendering of {@code report}
 * @param renderTimeMs   time spent gathering the data above
 */
public record DashboardView(
        String hostname,
        String environment,
        String version,
        String runtimeVersion,
        Duration uptime,
        HealthReport report,
        MetricsSnapshot snapshot,
        String summary,
        long renderTimeMs) {
}
