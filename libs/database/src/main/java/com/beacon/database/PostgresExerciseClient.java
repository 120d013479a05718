package com.beacon.database;

import com.beacon.observability.DependencyClient;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.sql.DataSource;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * On-demand database exercise: a {@link DependencyClient} whose metadata is the server version
 * and the number of logged requests.
 * <p>
 * Run through the regular probe so that failures come back as an unreachable check.
 */
public class PostgresExerciseClient implements DependencyClient {

    private final PostgresDependencyClient liveness;
    private final JdbcTemplate jdbcTemplate;
    private final RequestLogRepository requestLog;

    public PostgresExerciseClient(
            DataSource dataSource, JdbcTemplate jdbcTemplate, RequestLogRepository requestLog, int validationTimeoutSeconds) {
        if (requestLog == null) {
            throw new IllegalArgumentException("requestLog must not be null");
        }
        this.liveness = new PostgresDependencyClient(dataSource, jdbcTemplate, validationTimeoutSeconds);
        this.jdbcTemplate = jdbcTemplate;
        this.requestLog = requestLog;
    }

    @Override
    public String name() {
        return PostgresDependencyClient.NAME;
    }

    @Override
    public void checkLiveness() throws Exception {
        liveness.checkLiveness();
    }

    @Override
    public Map<String, String> queryMetadata() {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("database_version", PostgresDependencyClient.queryVersion(jdbcTemplate));
        metadata.put("total_requests", String.valueOf(requestLog.countRequests()));
        return metadata;
    }
}
