package com.beacon.database;

import com.beacon.observability.DependencyClient;
import com.beacon.observability.DependencyUnreachableException;
import com.beacon.observability.MalformedDependencyResponseException;
import java.sql.Connection;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.sql.DataSource;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * {@link DependencyClient} for the PostgreSQL database.
 * <p>
 * Liveness borrows a pooled connection and validates it; metadata reports the server version,
 * the number of tables in the {@code public} schema and the number of server backends.
 */
public class PostgresDependencyClient implements DependencyClient {

    /** Name under which the database appears in health reports. */
    public static final String NAME = "database";

    static final String VERSION_SQL = "SELECT version()";
    static final String TABLE_COUNT_SQL =
            "SELECT COUNT(*) FROM information_schema.tables WHERE table_schema = 'public'";
    static final String CONNECTION_COUNT_SQL = "SELECT COUNT(*) FROM pg_stat_activity";

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final int validationTimeoutSeconds;

    /**
     * @param dataSource               pooled data source owned by the application
     * @param jdbcTemplate             template over the same data source
     * @param validationTimeoutSeconds timeout passed to {@link Connection#isValid(int)}
     */
    public PostgresDependencyClient(DataSource dataSource, JdbcTemplate jdbcTemplate, int validationTimeoutSeconds) {
        if (dataSource == null || jdbcTemplate == null) {
            throw new IllegalArgumentException("dataSource and jdbcTemplate must not be null");
        }
        if (validationTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("validationTimeoutSeconds must be positive");
        }
        this.dataSource = dataSource;
        this.jdbcTemplate = jdbcTemplate;
        this.validationTimeoutSeconds = validationTimeoutSeconds;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void checkLiveness() throws Exception {
        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(validationTimeoutSeconds)) {
                throw new DependencyUnreachableException("Database connection failed validation");
            }
        }
    }

    @Override
    public Map<String, String> queryMetadata() {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("version", queryVersion(jdbcTemplate));
        metadata.put("table_count", String.valueOf(queryCount(jdbcTemplate, TABLE_COUNT_SQL)));
        metadata.put("connections", String.valueOf(queryCount(jdbcTemplate, CONNECTION_COUNT_SQL)));
        return metadata;
    }

    static String queryVersion(JdbcTemplate jdbcTemplate) {
        String version = jdbcTemplate.queryForObject(VERSION_SQL, String.class);
        if (version == null || version.isBlank()) {
            throw new MalformedDependencyResponseException("Database returned no version");
        }
        return version;
    }

    static long queryCount(JdbcTemplate jdbcTemplate, String sql) {
        Long count = jdbcTemplate.queryForObject(sql, Long.class);
        if (count == null) {
            throw new MalformedDependencyResponseException("Database returned no count for: " + sql);
        }
        return count;
    }
}
