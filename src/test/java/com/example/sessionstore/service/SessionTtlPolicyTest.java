package com.example.sessionstore.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.sessionstore.domain.entity.SessionCookie;
import com.example.sessionstore.domain.entity.SessionData;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SessionTtlPolicy Tests")
class SessionTtlPolicyTest {

  private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");
  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test
  @DisplayName("falls back to the static TTL without cookie expiry")
  void staticTtl() {
    SessionTtlPolicy policy = new SessionTtlPolicy(86400, null, clock);

    assertThat(policy.computeTtl(new SessionData("u1", null))).isEqualTo(86400);
    assertThat(policy.computeTtl(new SessionData("u1", SessionCookie.expiringAt(null)))).isEqualTo(86400);
  }

  @Test
  @DisplayName("derives TTL from the cookie expiry, rounding up")
  void cookieExpiryRoundsUp() {
    SessionTtlPolicy policy = new SessionTtlPolicy(86400, null, clock);

    assertThat(policy.computeTtl(new SessionData("u1", SessionCookie.expiringAt(NOW.plusMillis(1500)))))
        .isEqualTo(2);
    assertThat(policy.computeTtl(new SessionData("u1", SessionCookie.expiringAt(NOW.plusSeconds(60)))))
        .isEqualTo(60);
  }

  @Test
  @DisplayName("a cookie that expired five seconds ago yields a non-positive TTL")
  void expiredCookie() {
    SessionTtlPolicy policy = new SessionTtlPolicy(86400, null, clock);

    long ttl = policy.computeTtl(new SessionData("u1", SessionCookie.expiringAt(NOW.minusMillis(5000))));

    assertThat(ttl).isLessThanOrEqualTo(0);
  }

  @Test
  @DisplayName("the TTL function is used even when it returns zero")
  void functionWins() {
    SessionTtlPolicy policy = new SessionTtlPolicy(86400, s -> 0L, clock);

    assertThat(policy.computeTtl(new SessionData("u1", SessionCookie.expiringAt(NOW.plusSeconds(60)))))
        .isZero();
  }
}
