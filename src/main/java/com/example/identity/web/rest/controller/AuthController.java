package com.example.identity.web.rest.controller;

import com.example.identity.domain.entity.IssuedSession;
import com.example.identity.domain.entity.ResolvedIdentity;
import com.example.identity.exception.MissingCredentialException;
import com.example.identity.properties.ApplicationProperties;
import com.example.identity.service.SessionExchangeService;
import com.example.identity.service.SessionLifecycleService;
import com.example.identity.service.SessionService;
import com.example.identity.session.resolver.SessionTokenResolver;
import com.example.identity.util.CookieUtil;
import com.example.identity.web.rest.dto.SessionExchangeRequest;
import com.example.identity.web.rest.dto.SessionExchangeResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * REST controller for session creation, logout and lookup.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class AuthController implements AuthAPI {

  private static final String BEARER_PREFIX = "Bearer ";

  private final SessionExchangeService exchangeService;
  private final SessionLifecycleService lifecycleService;
  private final SessionService sessionService;
  private final SessionTokenResolver tokenResolver;
  private final ApplicationProperties properties;
  private final Clock clock;

  /**
   * Exchange an access token for a session.
   * Sets the token cookie always and the session-id cookie when a store entry exists.
   */
  @Override
  public ResponseEntity<SessionExchangeResponse> createSession(String authorization,
                                                               SessionExchangeRequest body,
                                                               HttpServletResponse response) {
    String accessToken = extractAccessToken(authorization, body);
    IssuedSession session = exchangeService.exchange(accessToken);

    ApplicationProperties.SessionProperties.TransportProperties transport = properties.session().transport();
    Duration maxAge = Duration.ofMillis(Math.max(0, session.expiresAt() - clock.millis()));
    CookieUtil.CookieAttributes attributes = cookieAttributes();

    CookieUtil.setSessionCookie(response, transport.tokenCookie(), session.token(), maxAge, attributes);
    if (session.hasStoreReference()) {
      CookieUtil.setSessionCookie(response, transport.sessionIdCookie(), session.sessionId(), maxAge, attributes);
    }

    return ResponseEntity.ok(SessionExchangeResponse.from(session));
  }

  /**
   * Logout endpoint - deletes store entries and clears cookies.
   */
  @Override
  public ResponseEntity<Map<String, Object>> logout(HttpServletRequest request, HttpServletResponse response) {
    log.debug("Logout request");

    tokenResolver.resolveAll(request).forEach(lifecycleService::destroy);

    ApplicationProperties.SessionProperties.TransportProperties transport = properties.session().transport();
    CookieUtil.CookieAttributes attributes = cookieAttributes();
    CookieUtil.clearSessionCookie(response, transport.tokenCookie(), attributes);
    CookieUtil.clearSessionCookie(response, transport.sessionIdCookie(), attributes);

    return ResponseEntity.ok(Map.of("success", true));
  }

  @Override
  public ResponseEntity<Map<String, Object>> me(HttpServletRequest request) {
    ResolvedIdentity identity = sessionService.requireSession(request);
    return ResponseEntity.ok(Map.of("user", identity));
  }

  @Override
  public ResponseEntity<Map<String, Object>> status(HttpServletRequest request) {
    boolean authenticated;
    try {
      authenticated = sessionService.resolve(request).isPresent();
    } catch (RuntimeException e) {
      log.error("Session status check failed", e);
      authenticated = false;
    }

    return ResponseEntity.ok(Map.of(
        "authenticated", authenticated,
        "timestamp", clock.millis()
                                   ));
  }

  private String extractAccessToken(String authorization, SessionExchangeRequest body) {
    if (authorization != null
        && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      String token = authorization.substring(BEARER_PREFIX.length()).trim();
      if (!token.isEmpty()) {
        return token;
      }
    }
    if (body != null && body.accessToken() != null && !body.accessToken().isBlank()) {
      return body.accessToken().trim();
    }
    throw new MissingCredentialException("Access token is required");
  }

  private CookieUtil.CookieAttributes cookieAttributes() {
    ApplicationProperties.SessionProperties.CookieProperties cookie = properties.session().cookie();
    return new CookieUtil.CookieAttributes(cookie.secure(), cookie.crossSiteEmbedding());
  }
}
