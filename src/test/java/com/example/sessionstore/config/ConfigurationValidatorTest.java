package com.example.sessionstore.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.sessionstore.properties.ApplicationProperties;
import com.example.sessionstore.properties.ApplicationProperties.RedisProperties;
import com.example.sessionstore.properties.ApplicationProperties.SessionStoreProperties;
import java.time.Duration;
import java.util.Base64;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConfigurationValidator Tests")
class ConfigurationValidatorTest {

  private static final String VALID_KEY = Base64.getEncoder().encodeToString(new byte[32]);

  private static SessionStoreProperties session(String client, int batchSize, String serializer, String key) {
    return new SessionStoreProperties(client, "sess:", batchSize, Duration.ofDays(1), false, false, serializer, key);
  }

  private static RedisProperties redis(String mode, String nodes) {
    return new RedisProperties(
        mode, "localhost", 6379, null, 0,
        new RedisProperties.SslProperties(false),
        new RedisProperties.ClusterProperties(nodes, 3),
        Duration.ofSeconds(2),
        new RedisProperties.PoolProperties(16, 8, 4, Duration.ofSeconds(2), Duration.ofSeconds(30)));
  }

  private static void validate(SessionStoreProperties session, RedisProperties redis) {
    new ConfigurationValidator(new ApplicationProperties(session, redis)).afterPropertiesSet();
  }

  @Test
  @DisplayName("defaults pass validation")
  void defaultsAreValid() {
    assertThatCode(() -> validate(session("lettuce", 100, "json", null), redis("standalone", null)))
        .doesNotThrowAnyException();
  }

  @Test
  @DisplayName("the encrypted serializer requires a 256-bit key")
  void encryptedSerializerNeedsKey() {
    assertThatThrownBy(() -> validate(session("lettuce", 100, "encrypted", null), redis("standalone", null)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("encryption-key");
    assertThatThrownBy(() -> validate(
        session("lettuce", 100, "encrypted", Base64.getEncoder().encodeToString(new byte[16])),
        redis("standalone", null)))
        .hasMessageContaining("32 bytes");
    assertThatCode(() -> validate(session("lettuce", 100, "encrypted", VALID_KEY), redis("standalone", null)))
        .doesNotThrowAnyException();
  }

  @Test
  @DisplayName("the native lettuce client is refused in cluster mode")
  void lettuceClientNotInCluster() {
    assertThatThrownBy(() -> validate(session("lettuce", 100, "json", null), redis("cluster", "r1:7000,r2:7000")))
        .hasMessageContaining("standalone mode only");
    assertThatCode(() -> validate(session("template", 100, "json", null), redis("cluster", "r1:7000,r2:7000")))
        .doesNotThrowAnyException();
  }

  @Test
  @DisplayName("all violations are reported together")
  void collectsAllErrors() {
    assertThatThrownBy(() -> validate(session("lettuce", 0, "json", null), redis("cluster", "")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("3 error(s)")
        .hasMessageContaining("Scan batch size")
        .hasMessageContaining("app.redis.cluster.nodes");
  }
}
