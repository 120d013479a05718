package com.beacon.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;

import com.beacon.observability.DependencyCheck;
import com.beacon.observability.DependencyProbe;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisServerCommands;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

/**
 * Unit tests for {@link RedisExerciseClient}: a fresh key per call, read back within the call.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("RedisExerciseClient")
class RedisExerciseClientTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Mock private RedisConnectionFactory connectionFactory;
    @Mock private RedisConnection connection;
    @Mock private RedisServerCommands serverCommands;
    @Mock private StringRedisTemplate redisTemplate;
    @Mock private ValueOperations<String, String> valueOperations;

    private final Map<String, String> store = new HashMap<>();
    private RedisExerciseClient client;

    @BeforeEach
    void setUp() {
        when(connectionFactory.getConnection()).thenReturn(connection);
        when(connection.ping()).thenReturn("PONG");
        when(connection.serverCommands()).thenReturn(serverCommands);
        when(serverCommands.info()).thenReturn(RedisDependencyClientTest.info());
        when(serverCommands.dbSize()).thenAnswer(invocation -> (long) store.size());
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        doAnswer(invocation -> store.put(invocation.getArgument(0), invocation.getArgument(1)))
                .when(valueOperations).set(anyString(), anyString(), eq(RedisExerciseClient.TTL));
        when(valueOperations.get(anyString())).thenAnswer(invocation -> store.get(invocation.<String>getArgument(0)));

        client = new RedisExerciseClient(connectionFactory, redisTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("should write, read back and report server facts")
    void shouldWriteAndReadBack() {
        DependencyCheck check = new DependencyProbe().probe(client);

        assertThat(check.reachable()).isTrue();
        assertThat(check.detail()).containsKeys(
                "test_key", "test_value", "retrieved_value", "redis_version", "memory_usage", "total_keys");
        assertThat(check.detail().get("retrieved_value")).isEqualTo(check.detail().get("test_value"));
        assertThat(check.detail().get("test_value")).isEqualTo("Hello from Redis at 2026-01-01T10:00:00Z");
        assertThat(check.detail().get("redis_version")).isEqualTo("7.2.4");
        assertThat(check.detail().get("total_keys")).isEqualTo("1");
    }

    @Test
    @DisplayName("should generate a fresh key on every call, even within the same millisecond")
    void shouldGenerateFreshKeys() {
        DependencyCheck first = new DependencyProbe().probe(client);
        DependencyCheck second = new DependencyProbe().probe(client);

        String firstKey = first.detail().get("test_key");
        String secondKey = second.detail().get("test_key");
        assertThat(firstKey).startsWith("test:" + NOW.toEpochMilli() + "-");
        assertThat(secondKey).isNotEqualTo(firstKey);
        assertThat(second.detail().get("retrieved_value")).isEqualTo(second.detail().get("test_value"));
        assertThat(store).containsKeys(firstKey, secondKey);
    }

    @Test
    @DisplayName("should report not found when the written key cannot be read back")
    void shouldReportNotFound() {
        when(valueOperations.get(anyString())).thenReturn(null);

        DependencyCheck check = new DependencyProbe().probe(client);

        assertThat(check.detail().get("retrieved_value")).isEqualTo("not found");
    }
}
