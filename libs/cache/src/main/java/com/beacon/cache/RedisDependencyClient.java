package com.beacon.cache;

import com.beacon.observability.DependencyClient;
import com.beacon.observability.MalformedDependencyResponseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;

/**
 * {@link DependencyClient} for the Redis cache.
 * <p>
 * Liveness is a {@code PING} that must answer {@code PONG}; metadata comes from {@code INFO}
 * and {@code DBSIZE}. Connections are borrowed from the application's connection factory.
 */
public class RedisDependencyClient implements DependencyClient {

    /** Name under which the cache appears in health reports. */
    public static final String NAME = "redis";

    private final RedisConnectionFactory connectionFactory;

    public RedisDependencyClient(RedisConnectionFactory connectionFactory) {
        if (connectionFactory == null) {
            throw new IllegalArgumentException("connectionFactory must not be null");
        }
        this.connectionFactory = connectionFactory;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void checkLiveness() {
        try (RedisConnection connection = connectionFactory.getConnection()) {
            ping(connection);
        }
    }

    @Override
    public Map<String, String> queryMetadata() {
        try (RedisConnection connection = connectionFactory.getConnection()) {
            ServerInfo info = ServerInfo.read(connection);
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("redis_version", info.version());
            metadata.put("used_memory_human", info.usedMemoryHuman());
            metadata.put("total_keys", String.valueOf(info.totalKeys()));
            return metadata;
        }
    }

    static void ping(RedisConnection connection) {
        String reply = connection.ping();
        if (!"PONG".equalsIgnoreCase(reply)) {
            throw new MalformedDependencyResponseException("Unexpected PING reply: " + reply);
        }
    }

    /**
     * Server facts read from {@code INFO} and {@code DBSIZE}.
     */
    record ServerInfo(String version, String usedMemoryHuman, long totalKeys) {

        static ServerInfo read(RedisConnection connection) {
            Properties info = connection.serverCommands().info();
            if (info == null) {
                throw new MalformedDependencyResponseException("Redis returned no INFO");
            }
            Long keys = connection.serverCommands().dbSize();
            if (keys == null) {
                throw new MalformedDependencyResponseException("Redis returned no DBSIZE");
            }
            return new ServerInfo(
                    info.getProperty("redis_version"), info.getProperty("used_memory_human"), keys);
        }
    }
}
