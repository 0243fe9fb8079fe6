package com.example.identity.exception;

/**
 * Hard failure: a server-side session record that violates the record invariants.
 * Never used for an ordinary "not authenticated" outcome.
 */
public class InvalidSessionException extends SessionException {
  public InvalidSessionException(String message) {
    super(message);
  }

  public InvalidSessionException(String message, Throwable cause) {
    super(message, cause);
  }
}
