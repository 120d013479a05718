package com.beacon.cache;

import com.beacon.observability.CounterName;
import com.beacon.observability.CounterStore;
import com.beacon.observability.MalformedDependencyResponseException;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * {@link CounterStore} keeping counters in Redis under their {@link CounterName#key()}.
 * <p>
 * Increments use {@code INCR}, which is atomic on the server, so counts stay correct across
 * concurrent requests and across application replicas. Calls throw
 * {@link org.springframework.dao.DataAccessException} when Redis is unreachable.
 */
public class RedisCounterStore implements CounterStore {

    private final StringRedisTemplate redisTemplate;

    public RedisCounterStore(StringRedisTemplate redisTemplate) {
        if (redisTemplate == null) {
            throw new IllegalArgumentException("redisTemplate must not be null");
        }
        this.redisTemplate = redisTemplate;
    }

    @Override
    public long increment(CounterName counter) {
        Long value = redisTemplate.opsForValue().increment(counter.key());
        if (value == null) {
            throw new MalformedDependencyResponseException("Redis returned no value for INCR " + counter.key());
        }
        return value;
    }

    @Override
    public long get(CounterName counter) {
        String value = redisTemplate.opsForValue().get(counter.key());
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedDependencyResponseException(
                    "Counter " + counter.key() + " holds a non-numeric value", e);
        }
    }
}
