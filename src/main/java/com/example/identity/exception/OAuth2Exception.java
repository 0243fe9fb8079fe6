package com.example.identity.exception;


/**
 * Raised when the external identity provider rejects an access token or cannot be reached.
 */
public class OAuth2Exception extends RuntimeException {
  public OAuth2Exception(String message) {
    super(message);
  }

  public OAuth2Exception(String message, Throwable cause) {
    super(message, cause);
  }
}
