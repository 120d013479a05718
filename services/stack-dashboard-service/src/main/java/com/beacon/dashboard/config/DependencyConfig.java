package com.beacon.dashboard.config;

import com.beacon.cache.RedisCounterStore;
import com.beacon.cache.RedisDependencyClient;
import com.beacon.cache.RedisExerciseClient;
import com.beacon.dashboard.service.MonitoredDependencies;
import com.beacon.database.PostgresDependencyClient;
import com.beacon.database.PostgresExerciseClient;
import com.beacon.database.RequestLogRepository;
import com.beacon.database.SchemaMigrator;
import com.beacon.observability.CounterStore;
import java.time.Clock;
import java.util.List;
import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * PostgreSQL and Redis clients on top of the pooled {@link DataSource} and the Lettuce
 * {@link RedisConnectionFactory} that Spring Boot configures.
 */
@Configuration
public class DependencyConfig {

    @Bean
    public PostgresDependencyClient postgresDependencyClient(
            DataSource dataSource, JdbcTemplate jdbcTemplate, DashboardProperties properties) {
        return new PostgresDependencyClient(dataSource, jdbcTemplate, properties.validationTimeoutSeconds());
    }

    @Bean
    public RedisDependencyClient redisDependencyClient(RedisConnectionFactory connectionFactory) {
        return new RedisDependencyClient(connectionFactory);
    }

    /**
     * Dependencies reported by {@code /health}, {@code /api/stats} and the dashboard, in display order.
     */
    @Bean
    public MonitoredDependencies monitoredDependencies(
            PostgresDependencyClient database, RedisDependencyClient redis) {
        return new MonitoredDependencies(List.of(database, redis));
    }

    @Bean
    public RequestLogRepository requestLogRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        return new RequestLogRepository(jdbcTemplate, transactionTemplate);
    }

    @Bean
    public PostgresExerciseClient postgresExerciseClient(
            DataSource dataSource,
            JdbcTemplate jdbcTemplate,
            RequestLogRepository requestLogRepository,
            DashboardProperties properties) {
        return new PostgresExerciseClient(
                dataSource, jdbcTemplate, requestLogRepository, properties.validationTimeoutSeconds());
    }

    @Bean
    public RedisExerciseClient redisExerciseClient(
            RedisConnectionFactory connectionFactory, StringRedisTemplate redisTemplate, Clock clock) {
        return new RedisExerciseClient(connectionFactory, redisTemplate, clock);
    }

    @Bean
    public SchemaMigrator schemaMigrator(DataSource dataSource) {
        return new SchemaMigrator(dataSource);
    }

    @Bean
    @ConditionalOnProperty(
            prefix = "beacon.dashboard",
            name = "counter-store",
            havingValue = DashboardProperties.COUNTER_STORE_REDIS)
    public CounterStore redisCounterStore(StringRedisTemplate redisTemplate) {
        return new RedisCounterStore(redisTemplate);
    }
}
