package com.beacon.cache;

import com.beacon.observability.DependencyClient;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * On-demand cache exercise: writes a fresh key with an expiry, reads it back and reports the
 * values together with server facts.
 * <p>
 * Every call generates a new key ({@code test:<epochMillis>-<sequence>}), so a call only ever
 * reads back its own write. The key expires after {@link #TTL}.
 */
public class RedisExerciseClient implements DependencyClient {

    /** Expiry of exercise keys. */
    public static final Duration TTL = Duration.ofSeconds(60);

    static final String KEY_PREFIX = "test:";
    static final String NOT_FOUND = "not found";

    private final RedisConnectionFactory connectionFactory;
    private final StringRedisTemplate redisTemplate;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public RedisExerciseClient(RedisConnectionFactory connectionFactory, StringRedisTemplate redisTemplate, Clock clock) {
        if (connectionFactory == null || redisTemplate == null || clock == null) {
            throw new IllegalArgumentException("connectionFactory, redisTemplate and clock must not be null");
        }
        this.connectionFactory = connectionFactory;
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    @Override
    public String name() {
        return RedisDependencyClient.NAME;
    }

    @Override
    public void checkLiveness() {
        try (RedisConnection connection = connectionFactory.getConnection()) {
            RedisDependencyClient.ping(connection);
        }
    }

    @Override
    public Map<String, String> queryMetadata() {
        String key = nextKey();
        String value = "Hello from Redis at " + clock.instant();
        redisTemplate.opsForValue().set(key, value, TTL);
        String retrieved = redisTemplate.opsForValue().get(key);

        RedisDependencyClient.ServerInfo info;
        try (RedisConnection connection = connectionFactory.getConnection()) {
            info = RedisDependencyClient.ServerInfo.read(connection);
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("test_key", key);
        metadata.put("test_value", value);
        metadata.put("retrieved_value", retrieved != null ? retrieved : NOT_FOUND);
        metadata.put("redis_version", info.version());
        metadata.put("memory_usage", info.usedMemoryHuman());
        metadata.put("total_keys", String.valueOf(info.totalKeys()));
        return metadata;
    }

    String nextKey() {
        return KEY_PREFIX + clock.millis() + "-" + sequence.incrementAndGet();
    }
}
