package com.example.sessionstore;

import com.example.sessionstore.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Session Store Application
 *
 * Redis-backed session persistence with:
 * - primary session keys and a per-user index for bulk invalidation
 * - native Lettuce or Spring Data Redis client
 * - maintenance REST endpoints
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
public class SessionStoreApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(SessionStoreApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
