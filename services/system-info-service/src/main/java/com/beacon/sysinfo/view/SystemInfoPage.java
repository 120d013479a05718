package com.beacon.sysinfo.view;

import com.beacon.observability.HostMetrics;
import com.beacon.sysinfo.config.SystemInfoProperties;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Renders the system-info HTML page.
 */
@Component
public class SystemInfoPage {

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    static final List<String> PACKAGING_TIPS = List.of(
            "Use a slim JRE base image instead of a full JDK",
            "Implement multi-stage builds",
            "Minimize the number of layers",
            "Use .dockerignore to exclude unnecessary files",
            "Run as non-root user for security");

    private static final String STYLE = """
            body { font-family: Arial, sans-serif; margin: 40px; \
            background: linear-gradient(135deg, #667eea 0%, #764ba2 100%); color: white; }
            .container { background: rgba(255,255,255,0.1); padding: 30px; border-radius: 15px; }
            .info-card { background: rgba(255,255,255,0.2); padding: 20px; margin: 15px 0; border-radius: 10px; }
            h1 { text-align: center; margin-bottom: 30px; }
            .metric { display: inline-block; margin: 10px; padding: 10px; background: rgba(255,255,255,0.3); \
            border-radius: 5px; }
            """;

    public String render(HostMetrics host, SystemInfoProperties properties, LocalDateTime now) {
        StringBuilder html = new StringBuilder(2048);
        html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"UTF-8\">\n")
                .append("<title>Container Image Demo</title>\n<style>\n").append(STYLE).append("</style>\n</head>\n")
                .append("<body>\n<div class=\"container\">\n<h1>Container Image Demo</h1>\n");

        html.append("<div class=\"info-card\">\n<h3>System Information</h3>\n");
        metric(html, "Memory Usage", host.memoryUsedMb() + " MB");
        metric(html, "CPU Count", String.valueOf(host.cpuCount()));
        metric(html, "Java Version", host.runtimeVersion());
        metric(html, "Container ID", host.hostname());
        metric(html, "Timestamp", TIMESTAMP.format(now));
        html.append("</div>\n");

        html.append("<div class=\"info-card\">\n<h3>Environment Variables</h3>\n");
        paragraph(html, "Environment", properties.environment());
        paragraph(html, "Debug Mode", String.valueOf(properties.debug()));
        paragraph(html, "Version", properties.version());
        html.append("</div>\n");

        html.append("<div class=\"info-card\">\n<h3>Image Optimization Tips</h3>\n<ul>\n");
        for (String tip : PACKAGING_TIPS) {
            html.append("<li>").append(HtmlUtils.htmlEscape(tip)).append("</li>\n");
        }
        html.append("</ul>\n</div>\n</div>\n</body>\n</html>\n");
        return html.toString();
    }

    private static void metric(StringBuilder html, String label, String value) {
        html.append("<div class=\"metric\"><strong>").append(label).append(":</strong> ")
                .append(HtmlUtils.htmlEscape(value)).append("</div>\n");
    }

    private static void paragraph(StringBuilder html, String label, String value) {
        html.append("<p><strong>").append(label).append(":</strong> ")
                .append(HtmlUtils.htmlEscape(value)).append("</p>\n");
    }
}
