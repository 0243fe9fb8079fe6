package com.example.identity.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Centralized configuration properties for the identity session gateway.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid AuthProperties auth,
    @NotNull @Valid SessionProperties session,
    @NotNull @Valid SecurityProperties security,
    @NotNull @Valid OkHttpProperties http,
    @NotNull @Valid RedisProperties redis
) {

  /**
   * External identity provider configuration
   */
  public record AuthProperties(@NotNull @Valid OidcProperties oidc) {
    public record OidcProperties(
        @NotBlank String userinfoUri
    ) {}
  }

  /**
   * Session lifetime, storage and transport configuration
   */
  public record SessionProperties(
      @DefaultValue("7d") Duration ttl,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration directoryTimeout,
      @NotNull @Valid StoreProperties store,
      @NotNull @Valid TokenProperties token,
      @NotNull @Valid TransportProperties transport,
      @NotNull @Valid CookieProperties cookie
  ) {
    /**
     * Backend selection: {@code redis}, {@code memory}, or {@code none} for tiers that cannot reach a store.
     */
    public record StoreProperties(
        @DefaultValue("memory") @Pattern(regexp = "redis|memory|none") String type,
        @DefaultValue("session:") @NotBlank String keyPrefix,
        @DefaultValue("100000") @Positive int maxEntries
    ) {}

    /**
     * Base64 HMAC key for self-contained tokens
     */
    public record TokenProperties(@NotBlank String signingKey) {}

    public record TransportProperties(
        @DefaultValue("user_session") @NotBlank String tokenCookie,
        @DefaultValue("admin_session_id") @NotBlank String sessionIdCookie,
        @DefaultValue("_token") @NotBlank String tokenParameter,
        @DefaultValue("_session") @NotBlank String sessionIdParameter
    ) {}

    public record CookieProperties(
        @DefaultValue("true") boolean secure,
        @DefaultValue("false") boolean crossSiteEmbedding
    ) {}
  }

  /**
   * Security configuration
   */
  public record SecurityProperties(
      @DefaultValue List<String> superAdmins,
      @NotNull @Valid @DefaultValue CorsProperties cors
  ) {

    /**
     * Cross-origin access for hosts that embed or call the auth endpoints.
     * No allowed origins means CORS stays off.
     */
    public record CorsProperties(
        @DefaultValue List<String> allowedOrigins,
        @DefaultValue({"GET", "POST", "OPTIONS"}) List<String> allowedMethods,
        @DefaultValue({"Content-Type", "Authorization"}) List<String> allowedHeaders,
        @DefaultValue("1h") @DurationUnit(ChronoUnit.SECONDS) Duration maxAge
    ) {}
  }

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @NotNull @Valid ClientProperties client
  ) {
    public record ClientProperties(
        @DefaultValue("20") @Positive int maxIdleConnections,
        @DefaultValue("5") @Positive int keepAliveDurationMinutes,
        @DefaultValue("100") @Positive int maxRequests,
        @DefaultValue("20") @Positive int maxRequestsPerHost
    ) {}
  }

  /**
   * Redis configuration with cluster support. Only read when the redis store is selected.
   */
  public record RedisProperties(
      @DefaultValue("standalone") @Pattern(regexp = "standalone|cluster") String mode,
      @DefaultValue("localhost") @NotBlank String host,
      @DefaultValue("6379") @Min(1) @Max(65535) int port,
      String password,
      @NotNull @Valid SslProperties ssl,
      @Valid ClusterProperties cluster,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @NotNull @Valid PoolProperties pool
  ) {
    public record SslProperties(
        @DefaultValue("false") boolean enabled
    ) {}

    public record ClusterProperties(
        String nodes,
        @DefaultValue("3") @Min(0) @Max(5) int maxRedirects
    ) {}

    public record PoolProperties(
        @DefaultValue("16") @Positive int maxActive,
        @DefaultValue("8") @Positive int maxIdle,
        @DefaultValue("4") @Positive int minIdle,
        @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration maxWait,
        @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration timeBetweenEvictionRuns
    ) {}
  }
}
