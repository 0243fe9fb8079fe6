package com.example.identity.exception;

/**
 * A self-contained session token that is not structurally decodable or whose signature does not match.
 */
public class MalformedTokenException extends SessionException {
  public MalformedTokenException(String message) {
    super(message);
  }

  public MalformedTokenException(String message, Throwable cause) {
    super(message, cause);
  }
}
