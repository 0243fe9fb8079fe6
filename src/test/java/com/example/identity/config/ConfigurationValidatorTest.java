package com.example.identity.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.identity.support.TestProperties;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConfigurationValidator")
class ConfigurationValidatorTest {

  private static String failureOf(TestProperties builder) {
    ConfigurationValidator validator = new ConfigurationValidator(builder.build());
    return assertThrows(IllegalStateException.class, validator::afterPropertiesSet).getMessage();
  }

  @Test
  @DisplayName("should accept the test defaults")
  void acceptsDefaults() {
    assertDoesNotThrow(() -> new ConfigurationValidator(TestProperties.defaults()).afterPropertiesSet());
  }

  @Nested
  @DisplayName("session")
  class Session {

    @Test
    @DisplayName("should reject a zero TTL")
    void zeroTtl() {
      assertTrue(failureOf(TestProperties.builder().ttl(Duration.ZERO)).contains("TTL"));
    }

    @Test
    @DisplayName("should reject a directory timeout under 50ms")
    void shortDirectoryTimeout() {
      assertTrue(failureOf(TestProperties.builder().directoryTimeout(Duration.ofMillis(10)))
                     .contains("Directory lookup timeout"));
    }

    @Test
    @DisplayName("should reject a signing key that is not base64")
    void notBase64() {
      assertTrue(failureOf(TestProperties.builder().signingKey("not base64!")).contains("base64"));
    }

    @Test
    @DisplayName("should reject the development signing key when cookies are secure")
    void developmentKeyInSecureDeployment() {
      String message = failureOf(TestProperties.builder()
                                     .signingKey(ConfigurationValidator.DEVELOPMENT_SIGNING_KEY)
                                     .cookies(true, false));

      assertTrue(message.contains("development key"));
    }

    @Test
    @DisplayName("should allow the development signing key for local plain-http runs")
    void developmentKeyLocally() {
      assertDoesNotThrow(() -> new ConfigurationValidator(
          TestProperties.builder()
              .signingKey(ConfigurationValidator.DEVELOPMENT_SIGNING_KEY)
              .cookies(false, false)
              .build()).afterPropertiesSet());
    }

    @Test
    @DisplayName("should reject a short signing key")
    void shortKey() {
      assertTrue(failureOf(TestProperties.builder().signingKey("c2hvcnQ=")).contains("at least"));
    }
  }

  @Nested
  @DisplayName("identity provider")
  class IdentityProvider {

    @Test
    @DisplayName("should require https for a remote userinfo endpoint")
    void remoteHttp() {
      assertTrue(failureOf(TestProperties.builder().userinfoUri("http://idp.example.com/userinfo"))
                     .contains("HTTPS"));
    }

    @Test
    @DisplayName("should allow http on localhost")
    void localHttp() {
      assertDoesNotThrow(() -> new ConfigurationValidator(
          TestProperties.builder().userinfoUri("http://localhost:8081/userinfo").build()).afterPropertiesSet());
    }

    @Test
    @DisplayName("should reject a relative userinfo URI")
    void relative() {
      assertTrue(failureOf(TestProperties.builder().userinfoUri("/userinfo")).contains("invalid"));
    }
  }

  @Nested
  @DisplayName("redis")
  class Redis {

    @Test
    @DisplayName("should reject cluster nodes without ports when the store is redis")
    void badClusterNodes() {
      String message = failureOf(TestProperties.builder().storeType("redis").redisCluster("redis-a,redis-b:6379"));

      assertTrue(message.contains("redis-a"));
    }

    @Test
    @DisplayName("should ignore redis settings when another store is configured")
    void ignoredForMemoryStore() {
      assertDoesNotThrow(() -> new ConfigurationValidator(
          TestProperties.builder().storeType("memory").redisCluster("redis-a").build()).afterPropertiesSet());
    }
  }

  @Test
  @DisplayName("should list every violation at once")
  void listsAll() {
    String message = failureOf(TestProperties.builder()
                                   .ttl(Duration.ZERO)
                                   .userinfoUri("http://idp.example.com/userinfo"));

    assertTrue(message.contains("2 error(s)"));
  }
}
