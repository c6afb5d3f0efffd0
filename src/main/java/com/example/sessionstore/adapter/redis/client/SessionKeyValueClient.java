package com.example.sessionstore.adapter.redis.client;

import java.util.List;
import java.util.stream.Stream;

/**
 * The key-value primitives the session store needs, independent of the Redis client
 * that actually talks to the server.
 *
 * <p>Implementations propagate client errors unchanged; they never retry.
 */
public interface SessionKeyValueClient {

  /**
   * @return the stored value, or {@code null} when the key does not exist
   */
  String get(String key);

  /**
   * Stores {@code value}. A positive {@code ttlSeconds} is applied atomically with the write;
   * {@code null} or a non-positive value stores the key without expiry.
   */
  void set(String key, String value, Long ttlSeconds);

  default void set(String key, String value) {
    set(key, value, null);
  }

  /**
   * @return {@code true} if the key existed and the timeout was applied
   */
  boolean expire(String key, long ttlSeconds);

  /**
   * @return values aligned by index with {@code keys}; missing keys map to {@code null}
   */
  List<String> multiGet(List<String> keys);

  /**
   * @return number of keys actually removed
   */
  long deleteMany(List<String> keys);

  /**
   * Incrementally scans the keyspace for keys matching a glob pattern. Every call starts a
   * fresh cursor; the returned stream pulls one bounded batch per round trip and must be
   * closed by the caller.
   */
  Stream<String> scan(String matchPattern, int batchSize);
}
