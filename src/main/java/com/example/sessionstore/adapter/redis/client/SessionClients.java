package com.example.sessionstore.adapter.redis.client;

import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisOperations;

/**
 * Detects which Redis client API a configured client speaks and wraps it once in the
 * matching {@link SessionKeyValueClient}.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class SessionClients {

  /**
   * Accepts a Lettuce {@link StatefulRedisConnection} or {@link RedisCommands}, a Spring Data
   * {@link RedisOperations} with string keys and values, or an already normalized client.
   *
   * @throws IllegalArgumentException when the client is missing or of an unsupported type
   */
  @SuppressWarnings("unchecked")
  public static SessionKeyValueClient normalize(Object client) {
    if (client == null) {
      throw new IllegalArgumentException("A Redis client is required");
    }
    if (client instanceof SessionKeyValueClient normalized) {
      return normalized;
    }
    if (client instanceof StatefulRedisConnection<?, ?> connection) {
      log.debug("Using Lettuce native connection for session storage");
      return new LettuceSessionClient(((StatefulRedisConnection<String, String>) connection).sync());
    }
    if (client instanceof RedisCommands<?, ?> commands) {
      log.debug("Using Lettuce native commands for session storage");
      return new LettuceSessionClient((RedisCommands<String, String>) commands);
    }
    if (client instanceof RedisOperations<?, ?> operations) {
      log.debug("Using Spring Data RedisOperations for session storage");
      return new RedisTemplateSessionClient((RedisOperations<String, String>) operations);
    }
    throw new IllegalArgumentException("Unsupported Redis client type: " + client.getClass().getName());
  }
}
