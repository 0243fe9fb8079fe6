package com.example.identity.session.store;

import com.example.identity.domain.entity.SessionRecord;
import com.example.identity.exception.SessionStoreUnavailableException;
import java.util.Optional;

/**
 * Expiring key/value storage of session records keyed by an opaque, store-generated identifier.
 *
 * <p>Every operation throws {@link SessionStoreUnavailableException} when the backend cannot be
 * reached, which callers must not confuse with an absent session.
 */
public interface SessionStore {

  /**
   * Persists the record under a freshly generated identifier. Any {@code sessionId} already on the
   * record is ignored.
   *
   * @return the new identifier
   */
  String create(SessionRecord record);

  /**
   * @return the record with its {@code sessionId} set, or empty when the identifier is unknown or
   *     the record has passed {@code expiresAt}
   */
  Optional<SessionRecord> get(String sessionId);

  void delete(String sessionId);
}
