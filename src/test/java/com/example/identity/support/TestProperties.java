package com.example.identity.support;

import com.example.identity.properties.ApplicationProperties;
import com.example.identity.properties.ApplicationProperties.AuthProperties;
import com.example.identity.properties.ApplicationProperties.OkHttpProperties;
import com.example.identity.properties.ApplicationProperties.RedisProperties;
import com.example.identity.properties.ApplicationProperties.SecurityProperties;
import com.example.identity.properties.ApplicationProperties.SessionProperties;
import java.time.Duration;
import java.util.List;

/**
 * Builds {@link ApplicationProperties} for tests without a Spring context.
 */
public final class TestProperties {

  // base64 of a 40-byte test key
  public static final String SIGNING_KEY = "dGVzdC1vbmx5LXNlc3Npb24tc2lnbmluZy1rZXktMDEyMzQ1Njc4OQ==";
  public static final Duration TTL = Duration.ofDays(7);

  private String userinfoUri = "https://idp.example.com/userinfo";
  private Duration ttl = TTL;
  private Duration directoryTimeout = Duration.ofSeconds(2);
  private String storeType = "memory";
  private String signingKey = SIGNING_KEY;
  private boolean secureCookies = true;
  private boolean crossSiteEmbedding = false;
  private List<String> superAdmins = List.of();
  private List<String> corsOrigins = List.of();
  private String redisMode = "standalone";
  private String clusterNodes = null;

  private TestProperties() {}

  public static TestProperties builder() {
    return new TestProperties();
  }

  public static ApplicationProperties defaults() {
    return builder().build();
  }

  public TestProperties userinfoUri(String userinfoUri) {
    this.userinfoUri = userinfoUri;
    return this;
  }

  public TestProperties ttl(Duration ttl) {
    this.ttl = ttl;
    return this;
  }

  public TestProperties directoryTimeout(Duration directoryTimeout) {
    this.directoryTimeout = directoryTimeout;
    return this;
  }

  public TestProperties storeType(String storeType) {
    this.storeType = storeType;
    return this;
  }

  public TestProperties signingKey(String signingKey) {
    this.signingKey = signingKey;
    return this;
  }

  public TestProperties cookies(boolean secure, boolean crossSiteEmbedding) {
    this.secureCookies = secure;
    this.crossSiteEmbedding = crossSiteEmbedding;
    return this;
  }

  public TestProperties superAdmins(String... emails) {
    this.superAdmins = List.of(emails);
    return this;
  }

  public TestProperties corsOrigins(String... origins) {
    this.corsOrigins = List.of(origins);
    return this;
  }

  public TestProperties redisCluster(String nodes) {
    this.redisMode = "cluster";
    this.clusterNodes = nodes;
    return this;
  }

  public ApplicationProperties build() {
    return new ApplicationProperties(
        new AuthProperties(new AuthProperties.OidcProperties(userinfoUri)),
        new SessionProperties(
            ttl,
            directoryTimeout,
            new SessionProperties.StoreProperties(storeType, "session:", 1000),
            new SessionProperties.TokenProperties(signingKey),
            new SessionProperties.TransportProperties("user_session", "admin_session_id", "_token", "_session"),
            new SessionProperties.CookieProperties(secureCookies, crossSiteEmbedding)),
        new SecurityProperties(superAdmins, new SecurityProperties.CorsProperties(
            corsOrigins, List.of("GET", "POST", "OPTIONS"), List.of("Content-Type", "Authorization"),
            Duration.ofHours(1))),
        new OkHttpProperties(new OkHttpProperties.ClientProperties(20, 5, 100, 20)),
        new RedisProperties(
            redisMode,
            "localhost",
            6379,
            null,
            new RedisProperties.SslProperties(false),
            new RedisProperties.ClusterProperties(clusterNodes, 3),
            Duration.ofSeconds(2),
            new RedisProperties.PoolProperties(16, 8, 4, Duration.ofSeconds(2), Duration.ofSeconds(30))));
  }
}
