package com.beacon.database;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import javax.sql.DataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link SchemaMigrator}: an unreachable database must not stop the application.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("SchemaMigrator")
class SchemaMigratorTest {

    @Mock private DataSource dataSource;

    @Test
    @DisplayName("should report failure instead of throwing when the database is down")
    void shouldReportFailureWhenDatabaseDown() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));

        boolean migrated = new SchemaMigrator(dataSource).migrate();

        assertThat(migrated).isFalse();
    }

    @Test
    @DisplayName("should reject a null data source")
    void shouldRejectNullDataSource() {
        assertThatThrownBy(() -> new SchemaMigrator(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should ship the request log migration on the classpath")
    void shouldShipMigration() {
        assertThat(getClass().getResource("/db/migration/V1__request_log.sql")).isNotNull();
    }
}
