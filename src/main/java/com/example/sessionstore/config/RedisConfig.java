package com.example.sessionstore.config;

import com.example.sessionstore.properties.ApplicationProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.SslOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.cluster.ClusterClientOptions;
import io.lettuce.core.cluster.ClusterTopologyRefreshOptions;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.actuate.data.redis.RedisHealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisNode;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis configuration.
 * Supports both standalone and cluster modes with connection pooling for the Spring Data
 * template, plus a dedicated native Lettuce connection when the session store is set to use it.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class RedisConfig {

  private final ApplicationProperties properties;

  /**
   * Shared client resources for all Redis connections
   */
  @Bean(destroyMethod = "shutdown")
  public ClientResources lettuceClientResources() {
    return DefaultClientResources.builder()
        .ioThreadPoolSize(Runtime.getRuntime().availableProcessors())
        .computationThreadPoolSize(Runtime.getRuntime().availableProcessors())
        .build();
  }

  /**
   * Connection pool configuration for the template connection factory
   */
  @Bean
  public GenericObjectPoolConfig<StatefulConnection<?, ?>> redisPoolConfig() {
    ApplicationProperties.RedisProperties.PoolProperties poolProps = properties.redis().pool();

    GenericObjectPoolConfig<StatefulConnection<?, ?>> config = new GenericObjectPoolConfig<>();
    config.setMaxTotal(poolProps.maxActive());
    config.setMaxIdle(poolProps.maxIdle());
    config.setMinIdle(poolProps.minIdle());
    config.setMaxWait(poolProps.maxWait());

    config.setTestOnBorrow(false);
    config.setTestWhileIdle(true);
    config.setTimeBetweenEvictionRuns(poolProps.timeBetweenEvictionRuns());
    config.setMinEvictableIdleDuration(Duration.ofMinutes(1));
    config.setNumTestsPerEvictionRun(3);

    return config;
  }

  /**
   * Redis connection factory with cluster support.
   */
  @Bean
  public RedisConnectionFactory redisConnectionFactory(
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    ApplicationProperties.RedisProperties redisProps = properties.redis();

    if ("cluster".equalsIgnoreCase(redisProps.mode()) &&
        redisProps.cluster() != null &&
        redisProps.cluster().nodes() != null &&
        !redisProps.cluster().nodes().isEmpty()) {
      return createClusterConnectionFactory(clientResources, poolConfig);
    } else {
      return createStandaloneConnectionFactory(clientResources, poolConfig);
    }
  }

  /**
   * String template; used as the session client when {@code app.session.client=template}
   */
  @Bean
  public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    StringRedisTemplate template = new StringRedisTemplate();
    template.setConnectionFactory(connectionFactory);
    template.setEnableTransactionSupport(false);
    template.afterPropertiesSet();
    return template;
  }

  /**
   * Native Lettuce client for the session store. Standalone only.
   */
  @Bean(destroyMethod = "shutdown")
  @ConditionalOnProperty(value = "app.session.client", havingValue = "lettuce", matchIfMissing = true)
  public RedisClient sessionRedisClient(ClientResources clientResources) {
    ApplicationProperties.RedisProperties redisProps = properties.redis();

    RedisURI.Builder uri = RedisURI.builder()
        .withHost(redisProps.host())
        .withPort(redisProps.port())
        .withDatabase(redisProps.database())
        .withSsl(redisProps.ssl().enabled())
        .withTimeout(redisProps.timeout());
    if (redisProps.password() != null && !redisProps.password().isEmpty()) {
      uri.withPassword(redisProps.password().toCharArray());
    }

    RedisClient client = RedisClient.create(clientResources, uri.build());
    client.setOptions(createEnhancedClientOptions(redisProps));
    log.info("Native Lettuce session client configured for {}:{}", redisProps.host(), redisProps.port());
    return client;
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(value = "app.session.client", havingValue = "lettuce", matchIfMissing = true)
  public StatefulRedisConnection<String, String> sessionRedisConnection(RedisClient sessionRedisClient) {
    return sessionRedisClient.connect();
  }

  /**
   * Redis health indicator for monitoring
   */
  @Bean
  public RedisHealthIndicator redisHealthIndicator(RedisConnectionFactory connectionFactory) {
    return new RedisHealthIndicator(connectionFactory);
  }

  private RedisConnectionFactory createStandaloneConnectionFactory(
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    ApplicationProperties.RedisProperties redisProps = properties.redis();

    RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration();
    redisConfig.setHostName(redisProps.host());
    redisConfig.setPort(redisProps.port());
    redisConfig.setPassword(redisProps.password());
    redisConfig.setDatabase(redisProps.database());

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .clientResources(clientResources)
            .commandTimeout(redisProps.timeout())
            .shutdownTimeout(Duration.ofSeconds(2))
            .clientOptions(createEnhancedClientOptions(redisProps));

    if (redisProps.ssl().enabled()) {
      builder.useSsl();
    }

    LettuceConnectionFactory factory = new LettuceConnectionFactory(redisConfig, builder.build());
    factory.setShareNativeConnection(true);
    factory.setValidateConnection(false);

    return factory;
  }

  private RedisConnectionFactory createClusterConnectionFactory(
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    ApplicationProperties.RedisProperties redisProps = properties.redis();
    ApplicationProperties.RedisProperties.ClusterProperties clusterProps = redisProps.cluster();

    RedisClusterConfiguration clusterConfig = new RedisClusterConfiguration();

    String[] nodes = clusterProps.nodes().split(",");
    for (String node : nodes) {
      String[] parts = node.trim().split(":");
      clusterConfig.addClusterNode(new RedisNode(parts[0], Integer.parseInt(parts[1])));
    }

    clusterConfig.setPassword(redisProps.password());
    clusterConfig.setMaxRedirects(clusterProps.maxRedirects());

    ClusterTopologyRefreshOptions topologyRefreshOptions =
        ClusterTopologyRefreshOptions.builder()
            .enablePeriodicRefresh(Duration.ofMinutes(1))
            .enableAllAdaptiveRefreshTriggers()
            .dynamicRefreshSources(true)
            .closeStaleConnections(true)
            .build();

    ClusterClientOptions.Builder clientOptions = ClusterClientOptions.builder()
        .topologyRefreshOptions(topologyRefreshOptions)
        .socketOptions(createSocketOptions(redisProps.timeout()))
        .validateClusterNodeMembership(false)
        .maxRedirects(clusterProps.maxRedirects())
        .timeoutOptions(TimeoutOptions.enabled(redisProps.timeout()));
    if (redisProps.ssl().enabled()) {
      clientOptions.sslOptions(createSslOptions());
    }

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .clientResources(clientResources)
            .clientOptions(clientOptions.build())
            .commandTimeout(redisProps.timeout());

    if (redisProps.ssl().enabled()) {
      builder.useSsl();
    }

    return new LettuceConnectionFactory(clusterConfig, builder.build());
  }

  private ClientOptions createEnhancedClientOptions(ApplicationProperties.RedisProperties redisProps) {
    ClientOptions.Builder builder = ClientOptions.builder()
        .socketOptions(createSocketOptions(redisProps.timeout()))
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        .publishOnScheduler(true)
        .timeoutOptions(TimeoutOptions.enabled(redisProps.timeout()));

    if (redisProps.ssl().enabled()) {
      builder.sslOptions(createSslOptions());
    }

    return builder.build();
  }

  private SocketOptions createSocketOptions(Duration timeout) {
    return SocketOptions.builder()
        .connectTimeout(timeout)
        .keepAlive(true)
        .tcpNoDelay(true)
        .build();
  }

  private SslOptions createSslOptions() {
    return SslOptions.builder()
        .jdkSslProvider()
        .build();
  }
}
