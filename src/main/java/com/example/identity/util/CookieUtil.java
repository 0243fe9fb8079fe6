package com.example.identity.util;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Cookie Utility for the session transport cookies
 * Uses Spring's ResponseCookie builder for proper cookie handling
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CookieUtil {

  private static final String COOKIE_PATH = "/";
  private static final String SAME_SITE_LAX = "Lax";
  private static final String SAME_SITE_NONE = "None";

  /**
   * Attributes shared by every session cookie
   *
   * @param secure whether the deployment serves TLS
   * @param crossSiteEmbedding relax SameSite to None for cross-origin frames
   */
  public record CookieAttributes(boolean secure, boolean crossSiteEmbedding) {

    String sameSite() {
      return crossSiteEmbedding ? SAME_SITE_NONE : SAME_SITE_LAX;
    }
  }

  /**
   * Extract cookie by name using Spring's WebUtils
   *
   * @param request HTTP request
   * @param name cookie name
   * @return Optional containing the cookie if found
   */
  public static Optional<Cookie> getCookie(HttpServletRequest request, String name) {
    if (request == null || name == null) {
      return Optional.empty();
    }

    try {
      Cookie cookie = WebUtils.getCookie(request, name);
      return Optional.ofNullable(cookie);
    } catch (Exception e) {
      log.debug("Error retrieving cookie '{}': {}", name, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Get decoded cookie value safely
   *
   * @param request HTTP request
   * @param name cookie name
   * @return Optional containing the decoded cookie value
   */
  public static Optional<String> getCookieValue(HttpServletRequest request, String name) {
    return getCookie(request, name)
        .map(Cookie::getValue)
        .filter(value -> value != null && !value.isEmpty())
        .map(CookieUtil::decodeCookieValue);
  }

  /**
   * Set an httpOnly session cookie on path "/"
   *
   * @param response HTTP response
   * @param name cookie name
   * @param value raw value, URL-encoded before it is written
   * @param maxAge lifetime, normally the session TTL
   * @param attributes secure / SameSite posture
   */
  public static void setSessionCookie(HttpServletResponse response,
                                      String name,
                                      String value,
                                      Duration maxAge,
                                      CookieAttributes attributes) {
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalArgumentException("Session cookie value cannot be null or empty");
    }

    ResponseCookie cookie = ResponseCookie
        .from(name, encodeCookieValue(value))
        .httpOnly(true)
        .secure(attributes.secure() || attributes.crossSiteEmbedding())
        .path(COOKIE_PATH)
        .maxAge(maxAge)
        .sameSite(attributes.sameSite())
        .build();

    response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());

    log.debug("Set session cookie: name={}, path={}, secure={}, httpOnly={}, sameSite={}",
              name, COOKIE_PATH, cookie.isSecure(), true, attributes.sameSite());
  }

  /**
   * Clear a session cookie; attributes must match the ones used when setting it
   */
  public static void clearSessionCookie(HttpServletResponse response, String name, CookieAttributes attributes) {
    ResponseCookie cookie = ResponseCookie
        .from(name, "")
        .httpOnly(true)
        .secure(attributes.secure() || attributes.crossSiteEmbedding())
        .path(COOKIE_PATH)
        .maxAge(0) // Immediate expiration
        .sameSite(attributes.sameSite())
        .build();

    response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());

    log.debug("Cleared session cookie: name={}", name);
  }

  /**
   * Encode cookie value for safe transport
   */
  private static String encodeCookieValue(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  /**
   * Decode cookie value safely
   */
  private static String decodeCookieValue(String encodedValue) {
    try {
      return URLDecoder.decode(encodedValue, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      log.debug("Failed to decode cookie value: {}", e.getMessage());
      return encodedValue; // Return as-is if decoding fails
    }
  }
}
