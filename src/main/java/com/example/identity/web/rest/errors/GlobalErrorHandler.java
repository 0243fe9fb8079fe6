package com.example.identity.web.rest.errors;

import com.example.identity.exception.InvalidSessionException;
import com.example.identity.exception.MissingCredentialException;
import com.example.identity.exception.OAuth2Exception;
import com.example.identity.exception.SessionException;
import com.example.identity.exception.SessionStoreUnavailableException;
import com.example.identity.exception.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global Error Handler
 *
 * Provides consistent error responses without exposing sensitive information. In particular a
 * client cannot tell a missing session from an unavailable store or directory.
 */
@Slf4j
@RestControllerAdvice
@RequestMapping(produces = {MediaType.APPLICATION_JSON_VALUE, MediaType.APPLICATION_PROBLEM_JSON_VALUE})
public class GlobalErrorHandler {

  private static final String INVALID_SESSION = "invalid_session";
  private static final String INVALID_SESSION_MESSAGE = "Session is invalid or expired";

  @ExceptionHandler(UnauthorizedException.class)
  public ResponseEntity<Map<String, Object>> handleUnauthorized(
      UnauthorizedException ex, WebRequest request) {
    log.debug("Unauthenticated request to {}", extractPath(request));

    return respond(HttpStatus.UNAUTHORIZED, INVALID_SESSION, INVALID_SESSION_MESSAGE, request);
  }

  @ExceptionHandler(InvalidSessionException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidSession(
      InvalidSessionException ex, WebRequest request) {
    log.error("Stored session failed integrity checks", ex);

    return respond(HttpStatus.UNAUTHORIZED, INVALID_SESSION, INVALID_SESSION_MESSAGE, request);
  }

  @ExceptionHandler(OAuth2Exception.class)
  public ResponseEntity<Map<String, Object>> handleOAuth2Exception(
      OAuth2Exception ex, WebRequest request) {
    log.warn("Access token exchange failed: {}", ex.getMessage());

    return respond(HttpStatus.UNAUTHORIZED, "invalid_token", "Invalid or expired access token", request);
  }

  @ExceptionHandler(MissingCredentialException.class)
  public ResponseEntity<Map<String, Object>> handleMissingCredential(
      MissingCredentialException ex, WebRequest request) {

    return respond(HttpStatus.BAD_REQUEST, "missing_token", ex.getMessage(), request);
  }

  @ExceptionHandler(SessionStoreUnavailableException.class)
  public ResponseEntity<Map<String, Object>> handleStoreUnavailable(
      SessionStoreUnavailableException ex, WebRequest request) {
    log.error("Session store unavailable", ex);

    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
                   "An error occurred processing your request", request);
  }

  @ExceptionHandler(SessionException.class)
  public ResponseEntity<Map<String, Object>> handleSessionException(
      SessionException ex, WebRequest request) {
    log.error("Session error", ex);

    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "session_error",
                   "An error occurred processing your request", request);
  }

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<Map<String, Object>> handleAuthenticationException(
      AuthenticationException ex, WebRequest request) {
    log.warn("Authentication error: {}", ex.getMessage());

    return respond(HttpStatus.UNAUTHORIZED, "authentication_failed", "Authentication failed", request);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<Map<String, Object>> handleAccessDeniedException(
      AccessDeniedException ex, WebRequest request) {
    log.warn("Access denied: {}", ex.getMessage());

    return respond(HttpStatus.FORBIDDEN, "access_denied", "Access denied", request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadableBody(
      HttpMessageNotReadableException ex, WebRequest request) {

    return respond(HttpStatus.BAD_REQUEST, "malformed_request", "Request body is not valid JSON", request);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<Map<String, Object>> handleMissingParams(
      MissingServletRequestParameterException ex, WebRequest request) {

    return respond(HttpStatus.BAD_REQUEST, "missing_parameter",
                   String.format("Missing required parameter: %s", ex.getParameterName()), request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {

    return respond(HttpStatus.METHOD_NOT_ALLOWED, "method_not_allowed",
                   String.format("Method %s not supported", ex.getMethod()), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(
      Exception ex, WebRequest request) {
    log.error("Unexpected error", ex);

    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
                   "An error occurred processing your request", request);
  }

  private ResponseEntity<Map<String, Object>> respond(
      HttpStatus status, String error, String message, WebRequest request) {

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", Instant.now());
    body.put("status", status.value());
    body.put("error", error);
    body.put("message", message);
    body.put("path", extractPath(request));

    return new ResponseEntity<>(body, status);
  }

  private String extractPath(WebRequest request) {
    String description = request.getDescription(false);
    return description.replace("uri=", "");
  }
}
