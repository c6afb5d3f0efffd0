package com.example.sessionstore.web.rest.controller;

import com.example.sessionstore.domain.entity.SessionData;
import com.example.sessionstore.domain.entity.StoredSession;
import com.example.sessionstore.exception.SessionStoreException;
import com.example.sessionstore.service.RedisSessionStore;
import com.example.sessionstore.service.StoreResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Session maintenance REST controller.
 * Translates store results into HTTP responses; failures go to the global error handler.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class SessionAdminController implements SessionAdminAPI {

  private final RedisSessionStore sessionStore;

  @Override
  public ResponseEntity<Map<String, Object>> listSessions() {
    List<StoredSession> sessions = unwrap(sessionStore.all()).orElse(List.of());
    return ResponseEntity.ok(Map.of(
        "sessions", sessions,
        "timestamp", System.currentTimeMillis()
                                   ));
  }

  @Override
  public ResponseEntity<Map<String, Object>> listSessionIds() {
    List<String> ids = unwrap(sessionStore.ids()).orElse(List.of());
    return ResponseEntity.ok(Map.of(
        "ids", ids,
        "timestamp", System.currentTimeMillis()
                                   ));
  }

  @Override
  public ResponseEntity<Map<String, Object>> countSessions() {
    int count = unwrap(sessionStore.length()).orElse(0);
    return ResponseEntity.ok(Map.of(
        "count", count,
        "timestamp", System.currentTimeMillis()
                                   ));
  }

  @Override
  public ResponseEntity<Map<String, Object>> getSession(String sessionId) {
    Optional<SessionData> session = unwrap(sessionStore.load(sessionId));
    return session
        .map(data -> ResponseEntity.ok(Map.<String, Object>of("id", sessionId, "session", data)))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @Override
  public ResponseEntity<Void> destroySession(String sessionId) {
    unwrap(sessionStore.destroy(sessionId));
    return ResponseEntity.noContent().build();
  }

  @Override
  public ResponseEntity<Map<String, Object>> clearSessions() {
    long removed = unwrap(sessionStore.clear()).orElse(0L);
    log.info("Cleared session namespace, {} keys removed", removed);
    return ResponseEntity.ok(Map.of("removedKeys", removed));
  }

  @Override
  public ResponseEntity<Map<String, Object>> listUserSessionIds(String userId) {
    List<String> ids = unwrap(sessionStore.idsForUser(userId)).orElse(List.of());
    return ResponseEntity.ok(Map.of(
        "userId", userId,
        "ids", ids
                                   ));
  }

  @Override
  public ResponseEntity<Map<String, Object>> clearUserSessions(String userId) {
    long removed = unwrap(sessionStore.clearForUser(userId)).orElse(0L);
    log.info("Cleared sessions of user {}, {} keys removed", userId, removed);
    return ResponseEntity.ok(Map.of(
        "userId", userId,
        "removedKeys", removed
                                   ));
  }

  /**
   * Invalid arguments are rethrown as-is so they map to 400; everything else is a store failure.
   */
  private <T> Optional<T> unwrap(StoreResult<T> result) {
    if (result instanceof StoreResult.Failure<T> failure) {
      if (failure.cause() instanceof IllegalArgumentException invalid) {
        throw invalid;
      }
      throw new SessionStoreException("Session store operation failed", failure.cause());
    }
    return result.toOptional();
  }
}
