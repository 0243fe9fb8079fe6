package com.example.identity.domain.entity;

/**
 * Both halves of a freshly created session, handed to the transport layer.
 *
 * @param sessionId store identifier, or null when the store was unavailable at creation
 * @param token self-contained encoding of the same record
 * @param expiresAt epoch millis shared by both halves
 */
public record IssuedSession(
    String sessionId,
    String token,
    long expiresAt
) {

  public boolean hasStoreReference() {
    return sessionId != null;
  }
}
