package com.example.identity.exception;

/**
 * The identity provider answered and refused the access token. Not counted as a provider failure.
 */
public class AccessTokenRejectedException extends OAuth2Exception {
  public AccessTokenRejectedException(String message) {
    super(message);
  }
}
