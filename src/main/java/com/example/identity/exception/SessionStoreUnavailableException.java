package com.example.identity.exception;

/**
 * The session store backend cannot be reached from the current execution tier.
 * Distinct from a missing session: callers degrade instead of treating it as "not logged in".
 */
public class SessionStoreUnavailableException extends SessionException {
  public SessionStoreUnavailableException(String message) {
    super(message);
  }

  public SessionStoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
