package com.beacon.dashboard.view;

import com.beacon.database.PostgresDependencyClient;
import com.beacon.observability.DependencyCheck;
import com.beacon.observability.HealthStatus;
import java.time.Duration;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Renders the dashboard HTML.
 *
 * <p>All dynamic values are HTML-escaped. A reachable dependency without facts, or an
 * unreachable one, shows {@code unavailable} in place of its detail.
 */
@Component
public class DashboardPage {

    static final String UNAVAILABLE = "unavailable";

    private static final String STYLE = """
            body { font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', sans-serif; margin: 0; \
            background: #f4f6fa; color: #222; }
            header { background: #1f3a5f; color: #fff; padding: 20px 32px; }
            main { padding: 24px 32px; }
            .grid { display: grid; grid-template-columns: repeat(auto-fit, minmax(260px, 1fr)); gap: 16px; }
            .card { background: #fff; border-radius: 8px; padding: 16px 20px; box-shadow: 0 1px 3px rgba(0,0,0,.1); }
            .badge { display: inline-block; padding: 2px 10px; border-radius: 12px; font-size: 12px; color: #fff; }
            .healthy { background: #2e7d32; }
            .unhealthy, .degraded { background: #c62828; }
            .tile { text-align: center; }
            .tile .value { font-size: 28px; font-weight: 600; }
            dl { display: grid; grid-template-columns: auto 1fr; gap: 4px 12px; margin: 8px 0 0; }
            dt { color: #666; }
            pre { background: #fff; padding: 12px; border-radius: 8px; overflow-x: auto; }
            footer { padding: 12px 32px; color: #666; font-size: 12px; }
            """;

    public String render(DashboardView view) {
        StringBuilder html = new StringBuilder(4096);
        html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"UTF-8\">\n")
                .append("<title>Stack Dashboard</title>\n<style>\n").append(STYLE).append("</style>\n</head>\n<body>\n");

        HealthStatus overall = view.report().overallStatus();
        html.append("<header><h1>Stack Dashboard</h1><span class=\"badge ")
                .append(overall.wireValue()).append("\">").append(escape(overall.name())).append("</span></header>\n");

        html.append("<main>\n<h2>Services</h2>\n<div class=\"grid\">\n");
        appendApplicationCard(html, view);
        for (DependencyCheck check : view.report().checks()) {
            appendDependencyCard(html, check);
        }
        html.append("</div>\n");

        html.append("<h2>Metrics</h2>\n<div class=\"grid\">\n");
        appendTile(html, "Total requests", String.valueOf(view.snapshot().requestCount()));
        appendTile(html, "DB connections", databaseConnections(view));
        appendTile(html, "Cache hits", String.valueOf(view.snapshot().cacheHitCount()));
        appendTile(html, "Render time (ms)", String.valueOf(view.renderTimeMs()));
        html.append("</div>\n");

        html.append("<h2>System information</h2>\n<div class=\"card\"><dl>\n");
        appendEntry(html, "Memory used (MB)", String.valueOf(view.snapshot().memoryUsedMb()));
        appendEntry(html, "CPU count", String.valueOf(view.snapshot().cpuCount()));
        appendEntry(html, "Java runtime", view.runtimeVersion());
        appendEntry(html, "Hostname", view.hostname());
        html.append("</dl></div>\n");

        html.append("<h2>Summary</h2>\n<pre>").append(escape(view.summary())).append("</pre>\n</main>\n");
        html.append("<footer>Last updated: ").append(escape(view.report().generatedAt().toString()))
                .append("</footer>\n</body>\n</html>\n");
        return html.toString();
    }

    private static void appendApplicationCard(StringBuilder html, DashboardView view) {
        html.append("<div class=\"card\"><h3>Web application <span class=\"badge healthy\">healthy</span></h3><dl>\n");
        appendEntry(html, "Hostname", view.hostname());
        appendEntry(html, "Environment", view.environment());
        appendEntry(html, "Version", view.version());
        appendEntry(html, "Uptime", formatUptime(view.uptime()));
        html.append("</dl></div>\n");
    }

    private static void appendDependencyCard(StringBuilder html, DependencyCheck check) {
        String status = check.reachable() ? "healthy" : "unhealthy";
        html.append("<div class=\"card\"><h3>").append(escape(check.name()))
                .append(" <span class=\"badge ").append(status).append("\">").append(status).append("</span></h3><dl>\n");
        if (check.detail().isEmpty()) {
            appendEntry(html, "detail", UNAVAILABLE);
        } else {
            for (Map.Entry<String, String> entry : check.detail().entrySet()) {
                appendEntry(html, entry.getKey(), entry.getValue());
            }
        }
        check.errorMessage().ifPresent(error -> appendEntry(html, "error", error));
        html.append("</dl></div>\n");
    }

    private static void appendTile(StringBuilder html, String label, String value) {
        html.append("<div class=\"card tile\"><div class=\"value\">").append(escape(value))
                .append("</div><div>").append(escape(label)).append("</div></div>\n");
    }

    private static void appendEntry(StringBuilder html, String key, String value) {
        html.append("<dt>").append(escape(key)).append("</dt><dd>").append(escape(value)).append("</dd>\n");
    }

    private static String databaseConnections(DashboardView view) {
        return view.report().check(PostgresDependencyClient.NAME)
                .map(check -> check.detail().get("connections"))
                .orElse(UNAVAILABLE);
    }

    static String formatUptime(Duration uptime) {
        long seconds = uptime.toSeconds();
        long days = seconds / 86_400;
        long hours = (seconds % 86_400) / 3_600;
        long minutes = (seconds % 3_600) / 60;
        long secs = seconds % 60;
        if (days > 0) {
            return String.format("%dd %dh %dm", days, hours, minutes);
        }
        if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes, secs);
        }
        return String.format("%dm %ds", minutes, secs);
    }

    private static String escape(String value) {
        return value == null ? UNAVAILABLE : HtmlUtils.htmlEscape(value);
    }
}
