package com.example.sessionstore.config;

import com.example.sessionstore.properties.ApplicationProperties;
import com.example.sessionstore.service.RedisSessionStore;
import com.example.sessionstore.service.SessionStoreOptions;
import com.example.sessionstore.service.codec.EncryptingSessionSerializer;
import com.example.sessionstore.service.codec.JacksonSessionSerializer;
import com.example.sessionstore.service.codec.SessionSerializer;
import io.lettuce.core.api.StatefulRedisConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Wires the session store from {@code app.session.*}.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class SessionStoreConfig {

  private static final String CLIENT_TEMPLATE = "template";
  private static final String SERIALIZER_ENCRYPTED = "encrypted";

  private final ApplicationProperties properties;

  @Bean
  public SessionSerializer sessionSerializer() {
    ApplicationProperties.SessionStoreProperties session = properties.session();
    JacksonSessionSerializer json = new JacksonSessionSerializer();
    if (SERIALIZER_ENCRYPTED.equals(session.serializer())) {
      log.info("Session payloads will be encrypted with AES-256-GCM");
      return EncryptingSessionSerializer.fromBase64Key(json, session.encryptionKey());
    }
    return json;
  }

  @Bean
  public RedisSessionStore redisSessionStore(
      SessionSerializer sessionSerializer,
      ObjectProvider<StatefulRedisConnection<String, String>> sessionRedisConnection,
      StringRedisTemplate stringRedisTemplate) {

    ApplicationProperties.SessionStoreProperties session = properties.session();
    Object client = CLIENT_TEMPLATE.equals(session.client())
        ? stringRedisTemplate
        : sessionRedisConnection.getObject();

    RedisSessionStore store = new RedisSessionStore(SessionStoreOptions.builder()
        .client(client)
        .prefix(session.prefix())
        .scanBatchSize(session.scanBatchSize())
        .serializer(sessionSerializer)
        .ttlSeconds(session.ttl().toSeconds())
        .disableTtl(session.disableTtl())
        .disableTouch(session.disableTouch())
        .build());

    log.info("Session store ready: client={}, prefix={}, ttl={}s, disableTtl={}, disableTouch={}",
        session.client(), store.keyScheme().getPrefix(), session.ttl().toSeconds(),
        session.disableTtl(), session.disableTouch());
    return store;
  }
}
