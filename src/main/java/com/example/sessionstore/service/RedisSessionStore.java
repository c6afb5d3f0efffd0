package com.example.sessionstore.service;

import com.example.sessionstore.adapter.redis.client.SessionClients;
import com.example.sessionstore.adapter.redis.client.SessionKeyValueClient;
import com.example.sessionstore.domain.entity.SessionData;
import com.example.sessionstore.domain.entity.StoredSession;
import com.example.sessionstore.service.codec.JacksonSessionSerializer;
import com.example.sessionstore.service.codec.SessionSerializer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Redis-backed session store.
 *
 * <p>Every session is written twice: the serialized record under its primary key and a
 * per-user index key whose value is the primary key. The pair is kept in step on save,
 * touch and destroy so that all sessions of a user can be found with a prefix scan.
 * Nothing is cached in-process; the instance only holds configuration.
 *
 * <p>Operations never throw for store errors. They return a {@link StoreResult} carrying
 * the client's exception unchanged; a missing session is a not-found result.
 */
@Slf4j
public class RedisSessionStore {

  public static final int DEFAULT_SCAN_BATCH_SIZE = 100;

  private final SessionKeyValueClient client;
  private final SessionKeyScheme keyScheme;
  private final SessionTtlPolicy ttlPolicy;
  private final SessionSerializer serializer;
  private final ScanEnumerator scanEnumerator;
  private final boolean disableTtl;
  private final boolean disableTouch;

  public RedisSessionStore(SessionStoreOptions options) {
    this.client = SessionClients.normalize(options.client());
    this.keyScheme = new SessionKeyScheme(options.prefix());
    this.ttlPolicy = new SessionTtlPolicy(
        options.ttlSeconds() != null ? options.ttlSeconds() : SessionTtlPolicy.DEFAULT_TTL_SECONDS,
        options.ttlFunction(),
        options.clock() != null ? options.clock() : Clock.systemUTC());
    this.serializer = options.serializer() != null ? options.serializer() : new JacksonSessionSerializer();
    int batchSize = options.scanBatchSize() != null && options.scanBatchSize() > 0
        ? options.scanBatchSize()
        : DEFAULT_SCAN_BATCH_SIZE;
    this.scanEnumerator = new ScanEnumerator(client, keyScheme, batchSize);
    this.disableTtl = options.disableTtl();
    this.disableTouch = options.disableTouch();
  }

  public SessionKeyScheme keyScheme() {
    return keyScheme;
  }

  public StoreResult<SessionData> load(String sessionId) {
    if (!keyScheme.isKeySafe(sessionId)) {
      return invalidSessionId();
    }
    return execute("load", sessionId, () -> {
      String data = client.get(keyScheme.primaryKey(sessionId));
      if (data == null) {
        return StoreResult.notFound();
      }
      return StoreResult.success(serializer.parse(data));
    });
  }

  /**
   * Writes the record and its index key. A TTL of zero or less destroys the session instead.
   * If the index write fails both keys are deleted before the failure is reported, so a
   * stale index key from an earlier save never outlives its record.
   */
  public StoreResult<Void> save(String sessionId, SessionData session) {
    StoreResult<Void> invalid = validate(sessionId, session);
    if (invalid != null) {
      return invalid;
    }
    String key = keyScheme.primaryKey(sessionId);
    String userKey = keyScheme.userIndexKey(session.getUserId(), sessionId);

    return execute("save", sessionId, () -> {
      long ttl = ttlPolicy.computeTtl(session);
      if (ttl <= 0) {
        log.debug("Session {} already expired (ttl={}), destroying", maskSessionId(sessionId), ttl);
        return destroy(sessionId);
      }
      String value = serializer.stringify(session);
      Long expiry = disableTtl ? null : ttl;

      client.set(key, value, expiry);
      try {
        client.set(userKey, key, expiry);
      } catch (RuntimeException e) {
        log.warn("Index write failed for session {}, removing both keys of the session",
            maskSessionId(sessionId));
        compensate(List.of(key, userKey), e);
        throw e;
      }
      return StoreResult.ok();
    });
  }

  /**
   * Refreshes the TTL of both keys without rewriting the payload.
   */
  public StoreResult<Void> touch(String sessionId, SessionData session) {
    if (disableTouch || disableTtl) {
      return StoreResult.ok();
    }
    StoreResult<Void> invalid = validate(sessionId, session);
    if (invalid != null) {
      return invalid;
    }
    String key = keyScheme.primaryKey(sessionId);
    String userKey = keyScheme.userIndexKey(session.getUserId(), sessionId);

    return execute("touch", sessionId, () -> {
      long ttl = ttlPolicy.computeTtl(session);
      if (ttl <= 0) {
        return destroy(sessionId);
      }
      client.expire(key, ttl);
      try {
        client.expire(userKey, ttl);
      } catch (RuntimeException e) {
        log.warn("Primary key of session {} refreshed but its index key was not; TTLs now diverge",
            maskSessionId(sessionId));
        throw e;
      }
      return StoreResult.ok();
    });
  }

  /**
   * Removes the session and its index key. The stored record is read first because the
   * index key depends on its user id; a missing session is a successful no-op.
   */
  public StoreResult<Void> destroy(String sessionId) {
    if (!keyScheme.isKeySafe(sessionId)) {
      return invalidSessionId();
    }
    return execute("destroy", sessionId, () -> {
      String key = keyScheme.primaryKey(sessionId);
      String data = client.get(key);
      if (data == null) {
        return StoreResult.ok();
      }
      String userId = serializer.parse(data).getUserId();
      if (keyScheme.isKeySafe(userId)) {
        client.deleteMany(List.of(key, keyScheme.userIndexKey(userId, sessionId)));
      } else {
        log.warn("Session {} has no usable user id, deleting primary key only", maskSessionId(sessionId));
        client.deleteMany(List.of(key));
      }
      return StoreResult.ok();
    });
  }

  /**
   * Deletes every key of the namespace.
   *
   * @return number of keys removed
   */
  public StoreResult<Long> clear() {
    return execute("clear", null, () -> StoreResult.success(deleteAll(scanEnumerator.namespaceKeys())));
  }

  /**
   * Deletes all sessions of one user, found through the index keys.
   *
   * @return number of keys removed, index and primary keys combined
   */
  public StoreResult<Long> clearForUser(String userId) {
    if (!keyScheme.isKeySafe(userId)) {
      return StoreResult.failure(new IllegalArgumentException("Invalid user id"));
    }
    return execute("clearForUser", null, () -> {
      long removed = deleteAll(scanEnumerator.userKeys(userId));
      log.debug("Cleared {} keys for user {}", removed, userId);
      return StoreResult.success(removed);
    });
  }

  /**
   * @return number of sessions; index keys are not counted
   */
  public StoreResult<Integer> length() {
    return execute("length", null, () -> StoreResult.success(scanEnumerator.primaryKeys().size()));
  }

  public StoreResult<List<String>> ids() {
    return execute("ids", null, () -> StoreResult.success(
        scanEnumerator.primaryKeys().stream()
            .map(keyScheme::sessionId)
            .collect(Collectors.toList())));
  }

  /**
   * Session ids of one user, read from the index keys only.
   */
  public StoreResult<List<String>> idsForUser(String userId) {
    if (!keyScheme.isKeySafe(userId)) {
      return StoreResult.failure(new IllegalArgumentException("Invalid user id"));
    }
    return execute("idsForUser", null, () -> StoreResult.success(
        scanEnumerator.userIndexKeys(userId).stream()
            .map(indexKey -> keyScheme.sessionId(keyScheme.primaryKeyForIndexKey(userId, indexKey)))
            .collect(Collectors.toList())));
  }

  /**
   * Every stored session with its id. Keys that expire between the scan and the fetch are
   * skipped.
   */
  public StoreResult<List<StoredSession>> all() {
    return execute("all", null, () -> {
      List<String> keys = scanEnumerator.primaryKeys();
      if (keys.isEmpty()) {
        return StoreResult.success(List.of());
      }
      List<String> values = client.multiGet(keys);
      List<StoredSession> sessions = new ArrayList<>(keys.size());
      for (int i = 0; i < keys.size(); i++) {
        String raw = values.get(i);
        if (raw == null) {
          continue;
        }
        sessions.add(new StoredSession(keyScheme.sessionId(keys.get(i)), serializer.parse(raw)));
      }
      return StoreResult.success(sessions);
    });
  }

  private long deleteAll(List<String> keys) {
    if (keys.isEmpty()) {
      return 0;
    }
    return client.deleteMany(keys);
  }

  private void compensate(List<String> keys, RuntimeException cause) {
    try {
      client.deleteMany(keys);
    } catch (RuntimeException cleanupFailure) {
      log.error("Could not remove keys {} after failed index write; index is now inconsistent",
          keys, cleanupFailure);
      cause.addSuppressed(cleanupFailure);
    }
  }

  private <T> StoreResult<T> invalidSessionId() {
    return StoreResult.failure(new IllegalArgumentException(
        "Session id must be non-empty and must not contain '" + keyScheme.getSeparator() + "'"));
  }

  private StoreResult<Void> validate(String sessionId, SessionData session) {
    if (!keyScheme.isKeySafe(sessionId)) {
      return invalidSessionId();
    }
    if (session == null || !keyScheme.isKeySafe(session.getUserId())) {
      return StoreResult.failure(new IllegalArgumentException(
          "Session must carry a user id without '" + keyScheme.getSeparator() + "'"));
    }
    return null;
  }

  private <T> StoreResult<T> execute(String operation, String sessionId, Supplier<StoreResult<T>> action) {
    try {
      return action.get();
    } catch (RuntimeException e) {
      log.error("Session store {} failed for session: {}", operation, maskSessionId(sessionId), e);
      return StoreResult.failure(e);
    }
  }

  private String maskSessionId(String sessionId) {
    if (sessionId == null) return "-";
    if (sessionId.length() < 8) return sessionId.isEmpty() ? "INVALID" : sessionId.charAt(0) + "...";
    return sessionId.substring(0, 8) + "...";
  }
}
