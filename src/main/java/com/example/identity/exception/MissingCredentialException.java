package com.example.identity.exception;

/**
 * The request carried no access token to exchange.
 */
public class MissingCredentialException extends RuntimeException {
  public MissingCredentialException(String message) {
    super(message);
  }
}
