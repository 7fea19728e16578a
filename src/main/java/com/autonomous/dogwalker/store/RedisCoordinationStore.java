package com.autonomous.dogwalker.store;

import com.autonomous.dogwalker.exception.StoreUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Redis-backed store shared by every orchestrator and worker process.
 * Compound operations run as Lua scripts so each one is a single atomic step.
 */
public class RedisCoordinationStore implements CoordinationStore {

    private static final RedisScript<Long> SET_ALL_IF_ABSENT = new DefaultRedisScript<>(
        "for i, key in ipairs(KEYS) do " +
        "  if redis.call('EXISTS', key) == 1 then return 0 end " +
        "end " +
        "for i, key in ipairs(KEYS) do " +
        "  redis.call('SET', key, ARGV[i + 1], 'PX', ARGV[1]) " +
        "end " +
        "return 1", Long.class);

    private static final RedisScript<Long> INCREMENT_WITH_TTL = new DefaultRedisScript<>(
        "local v = redis.call('INCR', KEYS[1]) " +
        "redis.call('PEXPIRE', KEYS[1], ARGV[1]) " +
        "return v", Long.class);

    private static final RedisScript<Long> DECREMENT_FLOOR_ZERO = new DefaultRedisScript<>(
        "local v = tonumber(redis.call('GET', KEYS[1]) or '0') " +
        "if v <= 0 then return 0 end " +
        "return redis.call('DECR', KEYS[1])", Long.class);

    private static final RedisScript<Long> APPEND_WITH_TTL = new DefaultRedisScript<>(
        "local n = redis.call('RPUSH', KEYS[1], ARGV[1]) " +
        "redis.call('PEXPIRE', KEYS[1], ARGV[2]) " +
        "return n", Long.class);

    private static final RedisScript<Long> ADVANCE = new DefaultRedisScript<>(
        "local v = tonumber(redis.call('GET', KEYS[1]) or '0') " +
        "if v >= tonumber(ARGV[1]) then return 0 end " +
        "redis.call('SET', KEYS[1], ARGV[1], 'PX', ARGV[2]) " +
        "return 1", Long.class);

    private final StringRedisTemplate redis;

    public RedisCoordinationStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public void ping() {
        call("ping", () -> redis.execute((RedisCallback<String>) RedisConnection::ping));
    }

    @Override
    public Optional<String> get(String key) {
        return call("get " + key, () -> Optional.ofNullable(redis.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call("set " + key, () -> {
            redis.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return call("setIfAbsent " + key,
            () -> Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(key, value, ttl)));
    }

    @Override
    public boolean setAllIfAbsent(Map<String, String> entries, Duration ttl) {
        List<String> keys = new ArrayList<>(entries.keySet());
        List<String> args = new ArrayList<>();
        args.add(Long.toString(ttl.toMillis()));
        keys.forEach(key -> args.add(entries.get(key)));
        return call("setAllIfAbsent " + keys,
            () -> toLong(redis.execute(SET_ALL_IF_ABSENT, keys, args.toArray())) == 1L);
    }

    @Override
    public boolean delete(String key) {
        return call("delete " + key, () -> Boolean.TRUE.equals(redis.delete(key)));
    }

    @Override
    public long increment(String key, Duration ttl) {
        return call("increment " + key,
            () -> toLong(redis.execute(INCREMENT_WITH_TTL, List.of(key), Long.toString(ttl.toMillis()))));
    }

    @Override
    public long decrementFloorZero(String key) {
        return call("decrement " + key, () -> toLong(redis.execute(DECREMENT_FLOOR_ZERO, List.of(key))));
    }

    @Override
    public long getLong(String key) {
        return get(key).map(Long::parseLong).orElse(0L);
    }

    @Override
    public long append(String key, String value, Duration ttl) {
        return call("append " + key,
            () -> toLong(redis.execute(APPEND_WITH_TTL, List.of(key), value, Long.toString(ttl.toMillis()))));
    }

    @Override
    public long length(String key) {
        return call("length " + key, () -> toLong(redis.opsForList().size(key)));
    }

    @Override
    public List<String> range(String key, long from, long to) {
        return call("range " + key, () -> {
            List<String> values = redis.opsForList().range(key, from, to);
            return values == null ? List.of() : values;
        });
    }

    @Override
    public boolean advance(String key, long value, Duration ttl) {
        return call("advance " + key, () -> toLong(redis.execute(ADVANCE, List.of(key),
            Long.toString(value), Long.toString(ttl.toMillis()))) == 1L);
    }

    private static long toLong(Long value) {
        return value == null ? 0L : value;
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
