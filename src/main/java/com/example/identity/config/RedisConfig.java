package com.example.identity.config;

import com.example.identity.properties.ApplicationProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.SslOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
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
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis connectivity for the session store.
 * Supports both standalone and cluster modes with connection pooling.
 * Only active when {@code app.session.store.type=redis}.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "app.session.store", name = "type", havingValue = "redis")
@RequiredArgsConstructor
public class RedisConfig {

  private final ApplicationProperties properties;

  @Bean(destroyMethod = "shutdown")
  public ClientResources lettuceClientResources() {
    return DefaultClientResources.builder()
        .ioThreadPoolSize(Runtime.getRuntime().availableProcessors())
        .computationThreadPoolSize(Runtime.getRuntime().availableProcessors())
        .build();
  }

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

  @Bean
  public RedisConnectionFactory redisConnectionFactory(
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    ApplicationProperties.RedisProperties redisProps = properties.redis();

    if ("cluster".equalsIgnoreCase(redisProps.mode()) &&
        redisProps.cluster() != null &&
        redisProps.cluster().nodes() != null &&
        !redisProps.cluster().nodes().isBlank()) {
      log.info("Configuring Redis session store in cluster mode");
      return createClusterConnectionFactory(redisProps.password(), clientResources, poolConfig);
    }
    log.info("Configuring Redis session store at {}:{}", redisProps.host(), redisProps.port());
    return createStandaloneConnectionFactory(redisProps.password(), clientResources, poolConfig);
  }

  /**
   * String template; session hashes hold string fields only
   */
  @Bean
  public RedisTemplate<String, String> redisTemplate(RedisConnectionFactory connectionFactory) {
    RedisTemplate<String, String> template = new RedisTemplate<>();
    template.setConnectionFactory(connectionFactory);

    StringRedisSerializer stringSerializer = new StringRedisSerializer();
    template.setKeySerializer(stringSerializer);
    template.setValueSerializer(stringSerializer);
    template.setHashKeySerializer(stringSerializer);
    template.setHashValueSerializer(stringSerializer);

    template.setEnableTransactionSupport(false);
    template.afterPropertiesSet();
    return template;
  }

  @Bean
  public RedisHealthIndicator redisHealthIndicator(RedisConnectionFactory connectionFactory) {
    return new RedisHealthIndicator(connectionFactory);
  }

  private RedisConnectionFactory createStandaloneConnectionFactory(
      String password,
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    ApplicationProperties.RedisProperties redisProps = properties.redis();

    RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration();
    redisConfig.setHostName(redisProps.host());
    redisConfig.setPort(redisProps.port());
    if (password != null && !password.isBlank()) {
      redisConfig.setPassword(password);
    }
    redisConfig.setDatabase(0);

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .clientResources(clientResources)
            .commandTimeout(redisProps.timeout())
            .shutdownTimeout(Duration.ofSeconds(2))
            .clientOptions(createClientOptions(redisProps));

    if (redisProps.ssl().enabled()) {
      builder.useSsl();
    }

    LettuceConnectionFactory factory = new LettuceConnectionFactory(redisConfig, builder.build());
    factory.setShareNativeConnection(true);
    factory.setValidateConnection(false);

    return factory;
  }

  private RedisConnectionFactory createClusterConnectionFactory(
      String password,
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    ApplicationProperties.RedisProperties redisProps = properties.redis();
    ApplicationProperties.RedisProperties.ClusterProperties clusterProps = redisProps.cluster();

    RedisClusterConfiguration clusterConfig = new RedisClusterConfiguration();
    for (String node : clusterProps.nodes().split(",")) {
      String[] parts = node.trim().split(":");
      clusterConfig.addClusterNode(new RedisNode(parts[0], Integer.parseInt(parts[1])));
    }
    if (password != null && !password.isBlank()) {
      clusterConfig.setPassword(password);
    }
    clusterConfig.setMaxRedirects(clusterProps.maxRedirects());

    ClusterTopologyRefreshOptions topologyRefreshOptions =
        ClusterTopologyRefreshOptions.builder()
            .enablePeriodicRefresh(Duration.ofMinutes(1))
            .enableAllAdaptiveRefreshTriggers()
            .dynamicRefreshSources(true)
            .closeStaleConnections(true)
            .build();

    ClusterClientOptions.Builder optionsBuilder = ClusterClientOptions.builder()
        .topologyRefreshOptions(topologyRefreshOptions)
        .socketOptions(createSocketOptions(redisProps.timeout()))
        .validateClusterNodeMembership(false)
        .maxRedirects(clusterProps.maxRedirects())
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        .timeoutOptions(TimeoutOptions.enabled(redisProps.timeout()));
    if (redisProps.ssl().enabled()) {
      optionsBuilder.sslOptions(createSslOptions());
    }

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .clientResources(clientResources)
            .clientOptions(optionsBuilder.build())
            .commandTimeout(redisProps.timeout());

    if (redisProps.ssl().enabled()) {
      builder.useSsl();
    }

    return new LettuceConnectionFactory(clusterConfig, builder.build());
  }

  // REJECT_COMMANDS makes an outage fail fast, which the session store reports as unavailable
  private ClientOptions createClientOptions(ApplicationProperties.RedisProperties redisProps) {
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
