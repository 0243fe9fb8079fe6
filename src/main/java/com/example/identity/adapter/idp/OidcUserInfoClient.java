package com.example.identity.adapter.idp;

import com.example.identity.domain.entity.ExternalClaims;
import com.example.identity.exception.AccessTokenRejectedException;
import com.example.identity.exception.OAuth2Exception;
import com.example.identity.properties.ApplicationProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * OIDC client that validates an access token by calling the provider's userinfo endpoint.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OidcUserInfoClient implements IdentityProviderClient {

  private static final String OIDC_BREAKER = "oidc";
  private static final String CLAIM_SUBJECT = "sub";
  private static final String CLAIM_EMAIL = "email";
  private static final String CLAIM_NAME = "name";
  private static final String CLAIM_PREFERRED_USERNAME = "preferred_username";
  private static final String CLAIM_TAGS = "tags";

  private final ApplicationProperties properties;
  private final OkHttpClient defaultOkHttpClient;
  private final ObjectMapper objectMapper;

  @Override
  @CircuitBreaker(name = OIDC_BREAKER, fallbackMethod = "exchangeFallback")
  public ExternalClaims exchange(String accessToken) {
    log.debug("Exchanging access token for claims at the OIDC userinfo endpoint");

    Request request = new Request.Builder()
        .url(properties.auth().oidc().userinfoUri())
        .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
        .header(HttpHeaders.ACCEPT, "application/json")
        .get()
        .build();

    try (Response response = defaultOkHttpClient.newCall(request).execute()) {
      if (response.code() == 401 || response.code() == 403) {
        throw new AccessTokenRejectedException("Access token rejected by identity provider");
      }
      ResponseBody body = response.body();
      if (!response.isSuccessful() || body == null) {
        throw new OAuth2Exception("Userinfo request failed, status: " + response.code());
      }

      return toClaims(objectMapper.readTree(body.string()));

    } catch (IOException e) {
      throw new OAuth2Exception("Userinfo request failed due to network error", e);
    }
  }

  public ExternalClaims exchangeFallback(String accessToken, Throwable ex) {
    if (ex instanceof OAuth2Exception oauth2Exception) {
      throw oauth2Exception;
    }
    log.error("OIDC circuit breaker is open during token exchange.", ex);
    throw new OAuth2Exception("Identity provider is temporarily unavailable.", ex);
  }

  private ExternalClaims toClaims(JsonNode userInfo) {
    if (userInfo == null || !userInfo.isObject()) {
      throw new OAuth2Exception("Userinfo response is not a JSON object");
    }
    String email = text(userInfo, CLAIM_EMAIL);
    String subject = text(userInfo, CLAIM_SUBJECT);
    if (subject == null) {
      subject = email;
    }
    if (subject == null) {
      throw new AccessTokenRejectedException("Userinfo response carries neither subject nor email");
    }
    String displayName = text(userInfo, CLAIM_NAME);
    if (displayName == null) {
      displayName = text(userInfo, CLAIM_PREFERRED_USERNAME);
    }
    return new ExternalClaims(subject, email, displayName, userInfo.get(CLAIM_TAGS));
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    String text = value.asText();
    return text.isBlank() ? null : text;
  }
}
