package com.example.sessionstore.service;

import com.example.sessionstore.domain.entity.SessionData;
import java.time.Clock;
import java.time.Instant;
import java.util.function.ToLongFunction;

/**
 * Effective time-to-live, in seconds, for a session record.
 *
 * <p>Precedence: a configured per-record function, then the cookie's own expiry, then the
 * static default. A result of zero or less means the record must not be persisted.
 */
public class SessionTtlPolicy {

  public static final long DEFAULT_TTL_SECONDS = 86400;

  private final long staticTtlSeconds;
  private final ToLongFunction<SessionData> ttlFunction;
  private final Clock clock;

  public SessionTtlPolicy(long staticTtlSeconds, ToLongFunction<SessionData> ttlFunction, Clock clock) {
    this.staticTtlSeconds = staticTtlSeconds;
    this.ttlFunction = ttlFunction;
    this.clock = clock;
  }

  public long computeTtl(SessionData session) {
    if (ttlFunction != null) {
      return ttlFunction.applyAsLong(session);
    }
    Instant expires = session != null && session.getCookie() != null ? session.getCookie().expires() : null;
    if (expires != null) {
      long remainingMillis = expires.toEpochMilli() - clock.millis();
      return (long) Math.ceil(remainingMillis / 1000.0);
    }
    return staticTtlSeconds;
  }
}
