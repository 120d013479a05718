package com.beacon.dashboard.view;

import static org.assertj.core.api.Assertions.assertThat;

import com.beacon.observability.DependencyCheck;
import com.beacon.observability.HealthReport;
import com.beacon.observability.MetricsSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DashboardPage")
class DashboardPageTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private final DashboardPage page = new DashboardPage();

    private static DashboardView view(List<DependencyCheck> checks) {
        return new DashboardView(
                "a1b2c3", "production", "1.0.0", "17.0.9", Duration.ofMinutes(61),
                HealthReport.of(checks, NOW),
                new MetricsSnapshot(64L * 1024 * 1024, 4, 10, 3, NOW),
                "Overall status: HEALTHY", 12);
    }

    @Test
    @DisplayName("shows application, dependencies and metric tiles")
    void showsEverything() {
        String html = page.render(view(List.of(
                DependencyCheck.reachable("database", Map.of("version", "PostgreSQL 15.4", "connections", "3")),
                DependencyCheck.unreachable("redis", "Connection refused"))));

        assertThat(html)
                .contains("a1b2c3", "production", "1h 1m 0s")
                .contains("PostgreSQL 15.4", "Connection refused", "unhealthy")
                .contains("Total requests", "DB connections", "Cache hits", "Render time (ms)")
                .contains("64.0", "17.0.9")
                .contains("Last updated: 2026-01-01T10:00:00Z");
    }

    @Test
    @DisplayName("shows unavailable for missing detail and DB connections")
    void showsUnavailable() {
        String html = page.render(view(List.of(DependencyCheck.unreachable("database", "Connection refused"))));

        assertThat(html).contains("<dt>detail</dt><dd>unavailable</dd>");
        assertThat(html).contains("<div class=\"value\">unavailable</div><div>DB connections</div>");
    }

    @Test
    @DisplayName("escapes dependency-provided text")
    void escapesHtml() {
        String html = page.render(view(List.of(DependencyCheck.unreachable("redis", "<script>alert(1)</script>"))));

        assertThat(html).doesNotContain("<script>").contains("&lt;script&gt;");
    }

    @Test
    @DisplayName("formats uptime")
    void formatsUptime() {
        assertThat(DashboardPage.formatUptime(Duration.ofSeconds(59))).isEqualTo("0m 59s");
        assertThat(DashboardPage.formatUptime(Duration.ofSeconds(3_725))).isEqualTo("1h 2m 5s");
        assertThat(DashboardPage.formatUptime(Duration.ofHours(49))).isEqualTo("2d 1h 0m");
    }
}
