package com.beacon.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;

/**
 * Formats a {@link HealthReport} for people or machines.
 * <p>
 * The machine form is a JSON object:
 * <pre>
 * {
 *   "overall_status": "degraded",
 *   "generated_at": "2026-01-01T10:00:00Z",
 *   "checks": [
 *     {"name": "database", "reachable": false, "error": "Connection refused"},
 *     {"name": "redis", "reachable": true, "detail": {"redis_version": "7.2.4"}}
 *   ]
 * }
 * </pre>
 * {@code detail} is omitted when empty and {@code error} when absent. Field order is fixed, so
 * identical reports render to identical documents. The human form lists the same facts, one
 * dependency per block, and shows {@code unavailable} where a reachable dependency exposed no
 * metadata.
 */
public final class ReportRenderer {

    public static final String FIELD_OVERALL_STATUS = "overall_status";
    public static final String FIELD_GENERATED_AT = "generated_at";
    public static final String FIELD_CHECKS = "checks";
    public static final String FIELD_NAME = "name";
    public static final String FIELD_REACHABLE = "reachable";
    public static final String FIELD_DETAIL = "detail";
    public static final String FIELD_ERROR = "error";

    static final String UNAVAILABLE = "unavailable";

    private final ObjectMapper mapper;

    public ReportRenderer() {
        this(new ObjectMapper());
    }

    public ReportRenderer(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper must not be null");
        }
        this.mapper = mapper;
    }

    /**
     * Renders the report in the requested format.
     *
     * @throws ReportRenderingException if JSON generation fails
     */
    public String render(HealthReport report, ReportFormat format) {
        if (report == null) {
            throw new IllegalArgumentException("report must not be null");
        }
        if (format == null) {
            throw new IllegalArgumentException("format must not be null");
        }
        return switch (format) {
            case MACHINE -> renderMachine(report);
            case HUMAN -> renderHuman(report);
        };
    }

    /**
     * Builds the machine document as a JSON tree.
     */
    public ObjectNode toDocument(HealthReport report) {
        ObjectNode root = mapper.createObjectNode();
        root.put(FIELD_OVERALL_STATUS, report.overallStatus().wireValue());
        root.put(FIELD_GENERATED_AT, report.generatedAt().toString());
        ArrayNode checks = root.putArray(FIELD_CHECKS);
        for (DependencyCheck check : report.checks()) {
            ObjectNode entry = checks.addObject();
            entry.put(FIELD_NAME, check.name());
            entry.put(FIELD_REACHABLE, check.reachable());
            if (!check.detail().isEmpty()) {
                ObjectNode detail = entry.putObject(FIELD_DETAIL);
                check.detail().forEach(detail::put);
            }
            check.errorMessage().ifPresent(error -> entry.put(FIELD_ERROR, error));
        }
        return root;
    }

    private String renderMachine(HealthReport report) {
        try {
            return mapper.writeValueAsString(toDocument(report));
        } catch (JsonProcessingException e) {
            throw new ReportRenderingException("Failed to render health report", e);
        }
    }

    private String renderHuman(HealthReport report) {
        StringBuilder out = new StringBuilder();
        out.append("Overall status: ").append(report.overallStatus()).append('\n');
        out.append("Generated at: ").append(report.generatedAt()).append('\n');
        if (report.checks().isEmpty()) {
            out.append("No dependencies configured\n");
        }
        for (DependencyCheck check : report.checks()) {
            out.append(check.name()).append(": ")
                    .append(check.reachable() ? "REACHABLE" : "UNREACHABLE").append('\n');
            if (check.reachable()) {
                appendDetail(out, check.detail());
            }
            check.errorMessage().ifPresent(error -> out.append("  error: ").append(error).append('\n'));
        }
        return out.toString();
    }

    private static void appendDetail(StringBuilder out, Map<String, String> detail) {
        if (detail.isEmpty()) {
            out.append("  detail: ").append(UNAVAILABLE).append('\n');
            return;
        }
        detail.forEach((key, value) -> out.append("  ").append(key).append(": ").append(value).append('\n'));
    }

    /**
     * Thrown when a report cannot be serialized.
     */
    public static class ReportRenderingException extends RuntimeException {
        public ReportRenderingException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
