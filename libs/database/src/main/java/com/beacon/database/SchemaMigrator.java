package com.beacon.database;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the request-log schema with Flyway.
 * <p>
 * Migration is best-effort: when the database is down at startup the failure is logged and the
 * application keeps serving (its health report will show the database as unreachable). The
 * schema is applied on the next start.
 * <p>
 * Existing schemas without a Flyway history table are baselined at version 0, so {@code V1}
 * still runs; its statements are idempotent.
 */
public class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    /** Default migration location on the classpath. */
    public static final String DEFAULT_LOCATION = "classpath:db/migration";

    private final Flyway flyway;

    public SchemaMigrator(DataSource dataSource) {
        this(dataSource, DEFAULT_LOCATION);
    }

    public SchemaMigrator(DataSource dataSource, String... locations) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        this.flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations(locations)
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .load();
    }

    /**
     * Runs pending migrations.
     *
     * @return {@code true} if the schema is up to date, {@code false} if migration failed
     */
    public boolean migrate() {
        try {
            int applied = flyway.migrate().migrationsExecuted;
            log.info("Database schema up to date ({} migrations applied)", applied);
            return true;
        } catch (RuntimeException e) {
            log.warn("Database schema migration skipped: {}", e.getMessage());
            return false;
        }
    }
}
