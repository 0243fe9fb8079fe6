package com.example.identity.domain.entity;

import java.util.List;

/**
 * An authenticated identity for a bounded time window.
 * Immutable; {@code expiresAt} is fixed at creation and never extended.
 */
public record SessionRecord(
    /**
     * Store key, 64 lowercase hex characters. Null for records decoded from a self-contained
     * token or not yet persisted.
     */
    String sessionId,

    /**
     * Primary key of the identity in the user directory.
     */
    String userId,

    /**
     * Stable subject asserted by the external identity provider.
     */
    String externalSubject,

    /**
     * Cached at creation time, may be stale. Not authoritative for authorization.
     */
    String email,

    /**
     * Cached at creation time, may be stale.
     */
    String displayName,

    /**
     * Capability labels asserted at login; authoritative for the session's lifetime.
     */
    List<String> tags,

    /**
     * Epoch millis.
     */
    long createdAt,

    /**
     * Epoch millis, {@code createdAt} plus the configured TTL.
     */
    long expiresAt
) {

  public SessionRecord {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public SessionRecord withSessionId(String id) {
    return new SessionRecord(id, userId, externalSubject, email, displayName, tags, createdAt, expiresAt);
  }

  public boolean isExpiredAt(long nowMillis) {
    return nowMillis >= expiresAt;
  }

  /**
   * True when the record references an identity and has a positive lifetime.
   */
  public boolean isWellFormed() {
    return userId != null && !userId.isBlank()
        && externalSubject != null && !externalSubject.isBlank()
        && expiresAt > createdAt;
  }
}
