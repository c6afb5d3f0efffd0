package com.example.sessionstore.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Cookie metadata stored alongside a session.
 * Only {@code expires} is read by the store; the rest is carried through untouched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionCookie(
    /**
     * Lifetime in milliseconds the cookie was issued with.
     */
    Long originalMaxAge,

    /**
     * Absolute expiry of the cookie, serialized as an ISO-8601 timestamp.
     */
    Instant expires,

    Boolean secure,
    Boolean httpOnly,
    String path,
    String domain,
    String sameSite
) {

  public static SessionCookie expiringAt(Instant expires) {
    return new SessionCookie(null, expires, null, null, "/", null, null);
  }
}
