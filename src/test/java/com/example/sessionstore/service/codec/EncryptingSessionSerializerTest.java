package com.example.sessionstore.service.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.sessionstore.domain.entity.SessionCookie;
import com.example.sessionstore.domain.entity.SessionData;
import com.example.sessionstore.exception.EncryptionException;
import java.time.Instant;
import java.util.Base64;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EncryptingSessionSerializer Tests")
class EncryptingSessionSerializerTest {

  private static final String KEY = Base64.getEncoder().encodeToString(new byte[32]);
  private static final String OTHER_KEY = Base64.getEncoder().encodeToString(new byte[] {
      1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16,
      17, 18, 19, 20, 21, 22, 23, 24, 25, 26, 27, 28, 29, 30, 31, 32});

  private final EncryptingSessionSerializer serializer =
      EncryptingSessionSerializer.fromBase64Key(new JacksonSessionSerializer(), KEY);

  @Test
  @DisplayName("stored text is not readable JSON and decrypts to the original session")
  void encryptsPayload() {
    SessionData session = new SessionData("u1", SessionCookie.expiringAt(Instant.parse("2025-01-01T00:00:00Z")));
    session.attribute("role", "admin");

    String stored = serializer.stringify(session);

    assertThat(stored).doesNotContain("userId").doesNotContain("admin");
    assertThat(serializer.parse(stored)).isEqualTo(session);
  }

  @Test
  @DisplayName("the same session encrypts differently each time")
  void freshIvPerWrite() {
    SessionData session = new SessionData("u1", null);

    assertThat(serializer.stringify(session)).isNotEqualTo(serializer.stringify(session));
  }

  @Test
  @DisplayName("a payload encrypted with another key is rejected")
  void wrongKey() {
    EncryptingSessionSerializer other =
        EncryptingSessionSerializer.fromBase64Key(new JacksonSessionSerializer(), OTHER_KEY);
    String stored = other.stringify(new SessionData("u1", null));

    assertThatThrownBy(() -> serializer.parse(stored)).isInstanceOf(EncryptionException.class);
  }

  @Test
  @DisplayName("keys that are not 256 bits are refused")
  void invalidKeyLength() {
    String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

    assertThatThrownBy(() -> EncryptingSessionSerializer.fromBase64Key(new JacksonSessionSerializer(), shortKey))
        .isInstanceOf(EncryptionException.class)
        .hasMessageContaining("256");
  }
}
