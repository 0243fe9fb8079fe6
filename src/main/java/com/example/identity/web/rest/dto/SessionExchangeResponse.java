package com.example.identity.web.rest.dto;

import com.example.identity.domain.entity.IssuedSession;

/**
 * @param sessionId null when the session was issued without a store entry
 */
public record SessionExchangeResponse(
    String sessionToken,
    String sessionId,
    long expiresAt
) {

  public static SessionExchangeResponse from(IssuedSession session) {
    return new SessionExchangeResponse(session.token(), session.sessionId(), session.expiresAt());
  }
}
