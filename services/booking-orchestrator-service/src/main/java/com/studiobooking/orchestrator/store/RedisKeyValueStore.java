package com.studiobooking.orchestrator.store;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class RedisKeyValueStore implements KeyValueStore {

  private static final int SCAN_BATCH = 100;

  @SuppressWarnings("rawtypes")
  private static final RedisScript<List> INCREMENT_WITHIN_LIMIT =
      new DefaultRedisScript<>(
          "local current = tonumber(redis.call('GET', KEYS[1]) or '0')\n"
              + "local amount = tonumber(ARGV[1])\n"
              + "local limit = tonumber(ARGV[2])\n"
              + "local ttl = tonumber(ARGV[3])\n"
              + "if current + amount > limit then\n"
              + "  if redis.call('EXISTS', KEYS[1]) == 1 then\n"
              + "    redis.call('EXPIRE', KEYS[1], ttl)\n"
              + "  end\n"
              + "  return {0, current}\n"
              + "end\n"
              + "local updated = redis.call('INCRBY', KEYS[1], amount)\n"
              + "redis.call('EXPIRE', KEYS[1], ttl)\n"
              + "return {1, updated}\n",
          List.class);

  private static final RedisScript<Long> DELETE_IF_EQUALS =
      new DefaultRedisScript<>(
          "if redis.call('GET', KEYS[1]) == ARGV[1] then\n"
              + "  return redis.call('DEL', KEYS[1])\n"
              + "end\n"
              + "return 0\n",
          Long.class);

  private final StringRedisTemplate redis;

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(redis.opsForValue().get(key));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    redis.opsForValue().set(key, value, ttl);
  }

  @Override
  public boolean setIfAbsent(String key, String value, Duration ttl) {
    return Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(key, value, ttl));
  }

  @Override
  public boolean delete(String key) {
    return Boolean.TRUE.equals(redis.delete(key));
  }

  @Override
  public boolean deleteIfEquals(String key, String expected) {
    Long removed = redis.execute(DELETE_IF_EQUALS, List.of(key), expected);
    return removed != null && removed > 0;
  }

  @Override
  public boolean expire(String key, Duration ttl) {
    return Boolean.TRUE.equals(redis.expire(key, ttl));
  }

  @Override
  public long deleteByPattern(String pattern) {
    List<String> batch = new ArrayList<>();
    long deleted = 0;
    ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
    try (Cursor<String> cursor = redis.scan(options)) {
      while (cursor.hasNext()) {
        batch.add(cursor.next());
        if (batch.size() >= SCAN_BATCH) {
          deleted += deleteAll(batch);
        }
      }
    }
    deleted += deleteAll(batch);
    return deleted;
  }

  private long deleteAll(List<String> keys) {
    if (keys.isEmpty()) {
      return 0;
    }
    Long n = redis.delete(keys);
    keys.clear();
    return n == null ? 0 : n;
  }

  @Override
  public long increment(String key, long amount, Duration ttl) {
    Long val = redis.opsForValue().increment(key, amount);
    redis.expire(key, ttl);
    return val == null ? 0L : val;
  }

  @Override
  @SuppressWarnings("unchecked")
  public CounterUpdate incrementWithinLimit(String key, long amount, long limit, Duration ttl) {
    List<Long> res =
        redis.execute(
            INCREMENT_WITHIN_LIMIT,
            List.of(key),
            Long.toString(amount),
            Long.toString(limit),
            Long.toString(Math.max(1, ttl.toSeconds())));
    if (res == null || res.size() < 2) {
      throw new IllegalStateException("Unexpected counter script result for " + key);
    }
    return new CounterUpdate(res.get(0) == 1L, res.get(1));
  }

  @Override
  public long leftPush(String key, String value) {
    Long size = redis.opsForList().leftPush(key, value);
    return size == null ? 0L : size;
  }

  @Override
  public Optional<String> rightPop(String key) {
    return Optional.ofNullable(redis.opsForList().rightPop(key));
  }

  @Override
  public long listSize(String key) {
    Long size = redis.opsForList().size(key);
    return size == null ? 0L : size;
  }

  @Override
  public boolean ping() {
    try {
      String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
      return "PONG".equalsIgnoreCase(pong);
    } catch (Exception e) {
      log.warn("Redis ping failed: {}", e.getMessage());
      return false;
    }
  }
}
