package com.example.identity.exception;

/**
 * Unauthorized Exception
 */
public class UnauthorizedException extends SessionException {
  public UnauthorizedException(String message) {
    super(message);
  }
}
