package com.example.identity.config;

import com.example.identity.properties.ApplicationProperties;
import com.example.identity.session.token.TokenSigningService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Configuration validator that enforces rules beyond basic JSR-303 validation.
 * Fails fast on startup with every violation listed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@EnableConfigurationProperties(ApplicationProperties.class)
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URI = "%s is invalid: %s";
  private static final String ERROR_HTTPS_REQUIRED = "%s must use HTTPS in non-local environments: %s";
  private static final String SCHEME_HTTP = "http";
  private static final String SCHEME_HTTPS = "https";
  private static final String HOST_LOCALHOST = "localhost";
  private static final String HOST_LOOPBACK = "127.0.0.1";
  private static final String STORE_REDIS = "redis";
  private static final String MODE_CLUSTER = "cluster";

  /**
   * Published in application-dev.yml, so anyone with the source can sign tokens with it
   */
  static final String DEVELOPMENT_SIGNING_KEY = "ZGV2LW9ubHktc2Vzc2lvbi1zaWduaW5nLWtleS1jaGFuZ2UtbWUtMDAwMDA=";

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration...");
    List<String> errors = new ArrayList<>();

    validateSessionConfig(errors);
    validateAuthConfig(errors);
    validateRedisConfig(errors);
    validateHttpConfig(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully (session store: {}).",
             properties.session().store().type());
  }

  private void validateSessionConfig(List<String> errors) {
    ApplicationProperties.SessionProperties session = properties.session();

    if (session.ttl() == null || session.ttl().isNegative() || session.ttl().isZero()) {
      errors.add("Session TTL must be positive: " + session.ttl());
    }
    if (session.directoryTimeout() == null || session.directoryTimeout().compareTo(Duration.ofMillis(50)) < 0) {
      errors.add("Directory lookup timeout must be at least 50ms: " + session.directoryTimeout());
    }

    String signingKey = session.token().signingKey();
    try {
      if (Base64.getDecoder().decode(signingKey.trim()).length < TokenSigningService.MIN_KEY_BYTES) {
        errors.add("Token signing key must decode to at least %d bytes.".formatted(TokenSigningService.MIN_KEY_BYTES));
      }
    } catch (IllegalArgumentException e) {
      errors.add("Token signing key is not valid base64.");
    }
    if (session.cookie().secure() && DEVELOPMENT_SIGNING_KEY.equals(signingKey.trim())) {
      errors.add("Token signing key is the development key; set SESSION_SIGNING_KEY for secure deployments.");
    }

    ApplicationProperties.SessionProperties.TransportProperties transport = session.transport();
    if (transport.tokenCookie().equals(transport.sessionIdCookie())) {
      errors.add("Token cookie and session-id cookie must have different names: " + transport.tokenCookie());
    }
    if (transport.tokenParameter().equals(transport.sessionIdParameter())) {
      errors.add("Token and session-id query parameters must have different names: " + transport.tokenParameter());
    }
  }

  private void validateAuthConfig(List<String> errors) {
    String userinfoUri = properties.auth().oidc().userinfoUri();
    try {
      URI uri = new URI(userinfoUri);
      if (uri.getScheme() == null || uri.getHost() == null) {
        errors.add(ERROR_INVALID_URI.formatted("OIDC userinfo URI", userinfoUri));
        return;
      }
      boolean local = HOST_LOCALHOST.equalsIgnoreCase(uri.getHost()) || HOST_LOOPBACK.equals(uri.getHost());
      if (SCHEME_HTTP.equalsIgnoreCase(uri.getScheme()) && !local) {
        errors.add(ERROR_HTTPS_REQUIRED.formatted("OIDC userinfo URI", userinfoUri));
      } else if (!SCHEME_HTTP.equalsIgnoreCase(uri.getScheme()) && !SCHEME_HTTPS.equalsIgnoreCase(uri.getScheme())) {
        errors.add(ERROR_INVALID_URI.formatted("OIDC userinfo URI", userinfoUri));
      }
    } catch (URISyntaxException e) {
      errors.add(ERROR_INVALID_URI.formatted("OIDC userinfo URI", userinfoUri));
    }
  }

  private void validateRedisConfig(List<String> errors) {
    if (!STORE_REDIS.equals(properties.session().store().type())) {
      return;
    }
    ApplicationProperties.RedisProperties redis = properties.redis();
    if (MODE_CLUSTER.equals(redis.mode())) {
      if (redis.cluster() == null || redis.cluster().nodes() == null || redis.cluster().nodes().isBlank()) {
        errors.add("Redis cluster mode requires 'app.redis.cluster.nodes'.");
        return;
      }
      for (String node : redis.cluster().nodes().split(",")) {
        if (!node.trim().matches("[^:\\s]+:\\d{1,5}")) {
          errors.add("Redis cluster node must be host:port: " + node.trim());
        }
      }
    }
    if (redis.pool().minIdle() > redis.pool().maxIdle()) {
      errors.add("Redis pool min-idle must not exceed max-idle.");
    }
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    if (client.maxRequests() < client.maxRequestsPerHost()) {
      errors.add("Total max requests must be greater than or equal to max requests per host.");
    }
  }
}
