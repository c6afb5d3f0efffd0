package com.example.sessionstore.adapter.redis.client;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.ScanOptions;

/**
 * Session client over Spring Data's {@link RedisOperations}: positional command arguments
 * and a server-side cursor id that the template advances for us.
 * Keys and values must be string-serialized, as with {@code StringRedisTemplate}.
 */
@RequiredArgsConstructor
public class RedisTemplateSessionClient implements SessionKeyValueClient {

  private final RedisOperations<String, String> redisOperations;

  @Override
  public String get(String key) {
    return redisOperations.opsForValue().get(key);
  }

  @Override
  public void set(String key, String value, Long ttlSeconds) {
    if (ttlSeconds != null && ttlSeconds > 0) {
      redisOperations.opsForValue().set(key, value, Duration.ofSeconds(ttlSeconds));
    } else {
      redisOperations.opsForValue().set(key, value);
    }
  }

  @Override
  public boolean expire(String key, long ttlSeconds) {
    return Boolean.TRUE.equals(redisOperations.expire(key, Duration.ofSeconds(ttlSeconds)));
  }

  @Override
  public List<String> multiGet(List<String> keys) {
    if (keys.isEmpty()) {
      return Collections.emptyList();
    }
    List<String> values = redisOperations.opsForValue().multiGet(keys);
    return values != null ? values : Collections.nCopies(keys.size(), null);
  }

  @Override
  public long deleteMany(List<String> keys) {
    if (keys.isEmpty()) {
      return 0;
    }
    Long removed = redisOperations.delete(keys);
    return removed != null ? removed : 0;
  }

  @Override
  public Stream<String> scan(String matchPattern, int batchSize) {
    Cursor<String> cursor = redisOperations.scan(
        ScanOptions.scanOptions().match(matchPattern).count(batchSize).build());
    return cursor.stream();
  }
}
