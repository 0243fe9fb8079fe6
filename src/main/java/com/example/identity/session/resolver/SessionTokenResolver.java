package com.example.identity.session.resolver;

import com.example.identity.properties.ApplicationProperties;
import com.example.identity.util.CookieUtil;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Extracts the single highest-priority session credential from a request.
 *
 * <p>Transports are examined in a fixed order and the first non-blank value wins:
 * <ol>
 *   <li>token cookie (self-contained token)</li>
 *   <li>session-id cookie (store identifier)</li>
 *   <li>token query parameter, for embedded frames that cannot set cookies</li>
 *   <li>session-id query parameter</li>
 *   <li>{@code Authorization: Bearer} header</li>
 * </ol>
 * The value is returned as-is; telling a store identifier from a token is the session service's job.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionTokenResolver {

  private static final String BEARER_PREFIX = "Bearer ";

  private final ApplicationProperties properties;

  public Optional<String> resolve(HttpServletRequest request) {
    return candidates(request).findFirst();
  }

  /**
   * Every non-blank credential on the request, highest priority first. Logout uses this so a
   * store entry is deleted even when a token in a higher-priority transport shadows it.
   */
  public List<String> resolveAll(HttpServletRequest request) {
    return candidates(request).distinct().toList();
  }

  private Stream<String> candidates(HttpServletRequest request) {
    if (request == null) {
      return Stream.empty();
    }
    ApplicationProperties.SessionProperties.TransportProperties transport =
        properties.session().transport();

    Stream<Function<HttpServletRequest, Optional<String>>> transports = Stream.of(
        req -> CookieUtil.getCookieValue(req, transport.tokenCookie()),
        req -> CookieUtil.getCookieValue(req, transport.sessionIdCookie()),
        req -> queryParameter(req, transport.tokenParameter()),
        req -> queryParameter(req, transport.sessionIdParameter()),
        SessionTokenResolver::bearerToken);

    return transports
        .map(transportReader -> transportReader.apply(request))
        .flatMap(Optional::stream)
        .map(String::trim)
        .filter(value -> !value.isEmpty());
  }

  /**
   * Reads from the URL query string only, never from a form body.
   */
  private static Optional<String> queryParameter(HttpServletRequest request, String name) {
    String queryString = request.getQueryString();
    if (queryString == null || queryString.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(UriComponentsBuilder.newInstance()
              .query(queryString)
              .build()
              .getQueryParams()
              .getFirst(name))
          .map(value -> UriUtils.decode(value, StandardCharsets.UTF_8));
    } catch (IllegalArgumentException e) {
      log.debug("Ignoring undecodable query parameter '{}': {}", name, e.getMessage());
      return Optional.empty();
    }
  }

  private static Optional<String> bearerToken(HttpServletRequest request) {
    String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header == null || header.length() <= BEARER_PREFIX.length()
        || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      return Optional.empty();
    }
    return Optional.of(header.substring(BEARER_PREFIX.length()));
  }
}
