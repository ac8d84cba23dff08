package com.postpilot.scheduler.counter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

@Component
@ConditionalOnProperty(name = "postpilot.counter-store.type", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RedisCounterStore implements CounterStore {

    // INCRBY and PEXPIRE in one round trip so a counter can never be left without a TTL
    static final RedisScript<Long> INCREMENT_WITH_EXPIRY = new DefaultRedisScript<>(
            "local value = redis.call('INCRBY', KEYS[1], ARGV[1]) " +
            "if redis.call('PTTL', KEYS[1]) < 0 then redis.call('PEXPIRE', KEYS[1], ARGV[2]) end " +
            "return value",
            Long.class);

    // plain DECRBY would create a missing key with no TTL
    static final RedisScript<Long> DECREMENT_IF_EXISTS = new DefaultRedisScript<>(
            "if redis.call('EXISTS', KEYS[1]) == 1 then return redis.call('DECRBY', KEYS[1], ARGV[1]) end " +
            "return 0",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    @Override
    public long incrementAndExpire(String key, long delta, Duration ttl) {
        try {
            Long value = redisTemplate.execute(INCREMENT_WITH_EXPIRY, List.of(key),
                    String.valueOf(delta), String.valueOf(ttl.toMillis()));
            return value != null ? value : 0L;
        } catch (DataAccessException e) {
            throw new CounterStoreException("Failed to increment counter " + key, e);
        }
    }

    @Override
    public long decrement(String key, long delta) {
        try {
            Long value = redisTemplate.execute(DECREMENT_IF_EXISTS, List.of(key), String.valueOf(delta));
            return value != null ? value : 0L;
        } catch (DataAccessException e) {
            throw new CounterStoreException("Failed to decrement counter " + key, e);
        }
    }

    @Override
    public long get(String key) {
        try {
            String value = redisTemplate.opsForValue().get(key);
            return value != null ? Long.parseLong(value) : 0L;
        } catch (DataAccessException e) {
            throw new CounterStoreException("Failed to read counter " + key, e);
        }
    }
}
