package com.example.sessionstore.domain.entity;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Represents the data associated with a user's session.
 * Mirrors the JSON document stored under the primary session key: the owning user,
 * the cookie metadata and any further attributes flattened next to them.
 */
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionData {

  /**
   * Owner of the session; drives the per-user index key.
   */
  private String userId;

  /**
   * Cookie metadata; its expiry takes part in TTL derivation.
   */
  private SessionCookie cookie;

  @Getter(lombok.AccessLevel.NONE)
  @Setter(lombok.AccessLevel.NONE)
  private final Map<String, Object> attributes = new LinkedHashMap<>();

  public SessionData(String userId, SessionCookie cookie) {
    this.userId = userId;
    this.cookie = cookie;
  }

  @JsonAnyGetter
  public Map<String, Object> attributes() {
    return attributes;
  }

  @JsonAnySetter
  public void attribute(String name, Object value) {
    attributes.put(name, value);
  }

  public Object attribute(String name) {
    return attributes.get(name);
  }
}
