package com.beacon.database;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Request log and persisted request counter.
 * <p>
 * Each recorded request inserts a row into {@code requests} and bumps the
 * {@code total_requests} row of {@code metrics} in the same transaction.
 */
public class RequestLogRepository {

    static final String INSERT_SQL =
            "INSERT INTO requests (ip_address, user_agent, endpoint) VALUES (?, ?, ?)";
    static final String INCREMENT_SQL =
            "UPDATE metrics SET metric_value = metric_value + 1, updated_at = CURRENT_TIMESTAMP "
                    + "WHERE metric_name = 'total_requests'";
    static final String COUNT_SQL = "SELECT COUNT(*) FROM requests";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionOperations transactions;

    public RequestLogRepository(JdbcTemplate jdbcTemplate, TransactionOperations transactions) {
        if (jdbcTemplate == null || transactions == null) {
            throw new IllegalArgumentException("jdbcTemplate and transactions must not be null");
        }
        this.jdbcTemplate = jdbcTemplate;
        this.transactions = transactions;
    }

    /**
     * Records a served request.
     *
     * @throws org.springframework.dao.DataAccessException if the database cannot be written
     */
    public void record(RequestLogEntry entry) {
        transactions.executeWithoutResult(status -> {
            jdbcTemplate.update(INSERT_SQL, entry.ipAddress(), entry.userAgent(), entry.endpoint());
            jdbcTemplate.update(INCREMENT_SQL);
        });
    }

    /**
     * Returns the number of logged requests.
     *
     * @throws org.springframework.dao.DataAccessException if the database cannot be read
     */
    public long countRequests() {
        return PostgresDependencyClient.queryCount(jdbcTemplate, COUNT_SQL);
    }
}
