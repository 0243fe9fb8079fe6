package com.example.identity.service;

import com.example.identity.adapter.directory.UserDirectory;
import com.example.identity.domain.entity.DirectoryUser;
import com.example.identity.domain.entity.IssuedSession;
import com.example.identity.domain.entity.SessionRecord;
import com.example.identity.exception.SessionException;
import com.example.identity.exception.SessionStoreUnavailableException;
import com.example.identity.properties.ApplicationProperties;
import com.example.identity.session.store.SessionIds;
import com.example.identity.session.store.SessionStore;
import com.example.identity.session.token.SessionTokenCodec;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Creates and destroys sessions.
 *
 * <p>A new session is issued in both forms: a store entry (when the store is reachable) and a
 * self-contained token built from the same record. Each form resolves on its own.
 */
@Slf4j
@Service
public class SessionLifecycleService {

  private final UserDirectory userDirectory;
  private final SessionStore sessionStore;
  private final SessionTokenCodec tokenCodec;
  private final Clock clock;
  private final Duration ttl;

  public SessionLifecycleService(
      UserDirectory userDirectory,
      SessionStore sessionStore,
      SessionTokenCodec tokenCodec,
      ApplicationProperties properties,
      Clock clock) {
    this.userDirectory = userDirectory;
    this.sessionStore = sessionStore;
    this.tokenCodec = tokenCodec;
    this.clock = clock;
    this.ttl = properties.session().ttl();
  }

  /**
   * Finds or creates the directory user and issues a session for it.
   *
   * @param tags already-normalized tags, stored as given
   * @return the issued session; {@code sessionId} is null when the store was unavailable
   */
  public IssuedSession create(String externalSubject, String email, String displayName, List<String> tags) {
    if (externalSubject == null || externalSubject.isBlank()) {
      throw new IllegalArgumentException("External subject is required to create a session");
    }

    DirectoryUser user = userDirectory.findOrCreate(externalSubject, email, displayName);
    long now = clock.millis();
    SessionRecord record = new SessionRecord(
        null,
        user.id(),
        user.externalSubject(),
        user.email(),
        user.displayName(),
        tags,
        now,
        now + ttl.toMillis());

    String sessionId = null;
    try {
      sessionId = sessionStore.create(record);
    } catch (SessionStoreUnavailableException e) {
      log.warn("Session store unavailable, issuing token-only session for user {}: {}",
               user.id(), e.getMessage());
    }

    String token;
    try {
      token = tokenCodec.encode(record);
    } catch (IllegalStateException e) {
      throw new SessionException("Failed to create session", e);
    }

    log.info("Session created for user {} (store reference: {})",
             user.id(), sessionId != null ? SessionIds.mask(sessionId) : "none");
    return new IssuedSession(sessionId, token, record.expiresAt());
  }

  /**
   * Ends the session a credential refers to.
   *
   * <p>Store identifiers are deleted from the store. Self-contained tokens carry no server state,
   * so there is nothing to delete; the caller clears its transports. A store outage is logged and
   * does not fail the logout.
   */
  public void destroy(String candidate) {
    if (candidate == null || !SessionIds.isStoreId(candidate)) {
      log.debug("No store-backed session to destroy");
      return;
    }
    try {
      sessionStore.delete(candidate);
      log.info("Session destroyed: {}", SessionIds.mask(candidate));
    } catch (SessionStoreUnavailableException e) {
      log.warn("Session store unavailable while destroying session {}: {}",
               SessionIds.mask(candidate), e.getMessage());
    }
  }
}
