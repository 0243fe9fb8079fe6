package com.example.identity.adapter.idp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.identity.domain.entity.ExternalClaims;
import com.example.identity.exception.AccessTokenRejectedException;
import com.example.identity.exception.OAuth2Exception;
import com.example.identity.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("OidcUserInfoClient")
class OidcUserInfoClientTest {

  private MockWebServer server;
  private OidcUserInfoClient client;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    client = new OidcUserInfoClient(
        TestProperties.builder().userinfoUri(server.url("/userinfo").toString()).build(),
        new OkHttpClient.Builder().readTimeout(2, TimeUnit.SECONDS).build(),
        new ObjectMapper());
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  private void respond(int status, String body) {
    server.enqueue(new MockResponse()
        .setResponseCode(status)
        .setHeader("Content-Type", "application/json")
        .setBody(body));
  }

  @Nested
  @DisplayName("accepted tokens")
  class Accepted {

    @Test
    @DisplayName("should send the token as a bearer credential")
    void sendsBearer() throws InterruptedException {
      respond(200, "{\"sub\":\"sub-1\",\"email\":\"ada@example.com\"}");

      client.exchange("access-123");

      RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
      assertEquals("GET", recorded.getMethod());
      assertEquals("/userinfo", recorded.getPath());
      assertEquals("Bearer access-123", recorded.getHeader("Authorization"));
    }

    @Test
    @DisplayName("should map subject, email, name and raw tags")
    void mapsClaims() {
      respond(200, "{\"sub\":\"sub-1\",\"email\":\"ada@example.com\",\"name\":\"Ada\",\"tags\":[\"editor\"]}");

      ExternalClaims claims = client.exchange("access");

      assertEquals("sub-1", claims.subject());
      assertEquals("ada@example.com", claims.email());
      assertEquals("Ada", claims.displayName());
      assertTrue(claims.tags().isArray());
    }

    @Test
    @DisplayName("should fall back to email as subject and preferred_username as name")
    void fallbacks() {
      respond(200, "{\"email\":\"ada@example.com\",\"preferred_username\":\"ada\"}");

      ExternalClaims claims = client.exchange("access");

      assertEquals("ada@example.com", claims.subject());
      assertEquals("ada", claims.displayName());
      assertNull(claims.tags());
    }
  }

  @Nested
  @DisplayName("rejections")
  class Rejections {

    @Test
    @DisplayName("401 is a rejected token")
    void unauthorized() {
      respond(401, "{}");

      assertThrows(AccessTokenRejectedException.class, () -> client.exchange("access"));
    }

    @Test
    @DisplayName("403 is a rejected token")
    void forbidden() {
      respond(403, "{}");

      assertThrows(AccessTokenRejectedException.class, () -> client.exchange("access"));
    }

    @Test
    @DisplayName("a userinfo response without subject or email is rejected")
    void noIdentity() {
      respond(200, "{\"name\":\"Nobody\"}");

      assertThrows(AccessTokenRejectedException.class, () -> client.exchange("access"));
    }
  }

  @Nested
  @DisplayName("provider failures")
  class Failures {

    @Test
    @DisplayName("a 5xx is a provider failure, not a rejection")
    void serverError() {
      respond(502, "bad gateway");

      OAuth2Exception ex = assertThrows(OAuth2Exception.class, () -> client.exchange("access"));
      assertTrue(ex.getMessage().contains("502"));
      assertFalse(ex instanceof AccessTokenRejectedException);
    }

    @Test
    @DisplayName("a non-object body is a provider failure")
    void notAnObject() {
      respond(200, "[1,2,3]");

      assertThrows(OAuth2Exception.class, () -> client.exchange("access"));
    }

    @Test
    @DisplayName("an unreachable provider is a provider failure")
    void unreachable() throws IOException {
      MockWebServer stopped = new MockWebServer();
      stopped.start();
      String url = stopped.url("/userinfo").toString();
      stopped.shutdown();
      OidcUserInfoClient unreachableClient = new OidcUserInfoClient(
          TestProperties.builder().userinfoUri(url).build(), new OkHttpClient(), new ObjectMapper());

      assertThrows(OAuth2Exception.class, () -> unreachableClient.exchange("access"));
    }

    @Test
    @DisplayName("the fallback rethrows provider errors unchanged")
    void fallbackRethrows() {
      AccessTokenRejectedException rejected = new AccessTokenRejectedException("rejected");

      OAuth2Exception thrown = assertThrows(OAuth2Exception.class,
                                            () -> client.exchangeFallback("access", rejected));
      assertEquals(rejected, thrown);
    }

    @Test
    @DisplayName("the fallback wraps an open breaker as a provider failure")
    void fallbackWrapsOtherErrors() {
      assertThrows(OAuth2Exception.class,
                   () -> client.exchangeFallback("access", new IllegalStateException("open")));
    }
  }
}
