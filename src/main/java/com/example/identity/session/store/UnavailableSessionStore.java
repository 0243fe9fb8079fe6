package com.example.identity.session.store;

import com.example.identity.domain.entity.SessionRecord;
import com.example.identity.exception.SessionStoreUnavailableException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Store for execution tiers that have no store backend. Only self-contained tokens resolve there.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.session.store", name = "type", havingValue = "none")
public class UnavailableSessionStore implements SessionStore {

  private static final String MESSAGE = "Session store is not available in this execution tier";

  public UnavailableSessionStore() {
    log.info("Session store disabled; only self-contained session tokens will resolve");
  }

  @Override
  public String create(SessionRecord record) {
    throw new SessionStoreUnavailableException(MESSAGE);
  }

  @Override
  public Optional<SessionRecord> get(String sessionId) {
    throw new SessionStoreUnavailableException(MESSAGE);
  }

  @Override
  public void delete(String sessionId) {
    throw new SessionStoreUnavailableException(MESSAGE);
  }
}
