package com.example.sessionstore.config;

import com.example.sessionstore.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Configuration validator that enforces cross-field rules beyond basic JSR-303 validation.
 * Fails fast on startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@EnableConfigurationProperties(ApplicationProperties.class)
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_MUST_BE_BETWEEN = "%s must be between %d and %d, but was: %d";
  private static final String ERROR_MIN_DURATION = "%s must be at least %s.";
  private static final String CLIENT_LETTUCE = "lettuce";
  private static final String MODE_CLUSTER = "cluster";
  private static final String SERIALIZER_ENCRYPTED = "encrypted";
  private static final int MAX_SCAN_BATCH_SIZE = 10_000;
  private static final int ENCRYPTION_KEY_BYTES = 32;

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating session store configuration...");
    List<String> errors = new ArrayList<>();

    validateSessionConfig(errors);
    validateRedisConfig(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  private void validateSessionConfig(List<String> errors) {
    ApplicationProperties.SessionStoreProperties session = properties.session();

    int batchSize = session.scanBatchSize();
    if (batchSize < 1 || batchSize > MAX_SCAN_BATCH_SIZE) {
      errors.add(ERROR_MUST_BE_BETWEEN.formatted("Scan batch size", 1, MAX_SCAN_BATCH_SIZE, batchSize));
    }
    if (session.ttl() == null || session.ttl().compareTo(Duration.ofSeconds(1)) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Session TTL", "1 second"));
    }
    if (session.disableTtl() && session.disableTouch()) {
      log.warn("Both disable-ttl and disable-touch are set; disable-touch is redundant");
    }
    if (SERIALIZER_ENCRYPTED.equals(session.serializer())) {
      validateEncryptionKey(session.encryptionKey(), errors);
    }
  }

  private void validateEncryptionKey(String keyBase64, List<String> errors) {
    if (keyBase64 == null || keyBase64.isBlank()) {
      errors.add("'app.session.encryption-key' is required when the encrypted serializer is selected.");
      return;
    }
    try {
      int length = Base64.getDecoder().decode(keyBase64).length;
      if (length != ENCRYPTION_KEY_BYTES) {
        errors.add("Encryption key must decode to %d bytes, but was: %d".formatted(ENCRYPTION_KEY_BYTES, length));
      }
    } catch (IllegalArgumentException e) {
      errors.add("Encryption key is not valid Base64.");
    }
  }

  private void validateRedisConfig(List<String> errors) {
    ApplicationProperties.RedisProperties redis = properties.redis();
    boolean cluster = MODE_CLUSTER.equalsIgnoreCase(redis.mode());

    if (cluster && (redis.cluster() == null || redis.cluster().nodes() == null || redis.cluster().nodes().isBlank())) {
      errors.add("Cluster mode requires 'app.redis.cluster.nodes'.");
    }
    if (cluster && CLIENT_LETTUCE.equals(properties.session().client())) {
      errors.add("The native lettuce session client supports standalone mode only; use 'template' in cluster mode.");
    }
    if (redis.pool().minIdle() > redis.pool().maxIdle() || redis.pool().maxIdle() > redis.pool().maxActive()) {
      errors.add("Pool sizes must satisfy min-idle <= max-idle <= max-active.");
    }
  }
}
