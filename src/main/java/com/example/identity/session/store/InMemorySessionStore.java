package com.example.identity.session.store;

import com.example.identity.domain.entity.SessionRecord;
import com.example.identity.properties.ApplicationProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * In-process session store backed by a Caffeine cache.
 *
 * <p>Each entry expires at its record's {@code expiresAt}; reads also check the clock so an entry
 * is never returned past its expiry even before Caffeine evicts it. Sessions are lost on restart
 * and are not shared between instances.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.session.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemorySessionStore implements SessionStore {

  private final Cache<String, SessionRecord> sessions;
  private final Clock clock;

  public InMemorySessionStore(ApplicationProperties properties, Clock clock) {
    this.clock = clock;
    this.sessions = Caffeine.newBuilder()
        .maximumSize(properties.session().store().maxEntries())
        .expireAfter(new RecordExpiry(clock))
        .build();
  }

  @Override
  public String create(SessionRecord record) {
    String sessionId = SessionIds.generate();
    while (sessions.asMap().putIfAbsent(sessionId, record.withSessionId(sessionId)) != null) {
      log.warn("Session ID collision detected, regenerating");
      sessionId = SessionIds.generate();
    }
    log.debug("Created in-memory session {}", SessionIds.mask(sessionId));
    return sessionId;
  }

  @Override
  public Optional<SessionRecord> get(String sessionId) {
    SessionRecord record = sessions.getIfPresent(sessionId);
    if (record == null) {
      return Optional.empty();
    }
    if (record.isExpiredAt(clock.millis())) {
      sessions.invalidate(sessionId);
      return Optional.empty();
    }
    return Optional.of(record);
  }

  @Override
  public void delete(String sessionId) {
    sessions.invalidate(sessionId);
  }

  private static final class RecordExpiry implements Expiry<String, SessionRecord> {

    private final Clock clock;

    private RecordExpiry(Clock clock) {
      this.clock = clock;
    }

    @Override
    public long expireAfterCreate(String key, SessionRecord value, long currentTime) {
      long remainingMillis = Math.max(0, value.expiresAt() - clock.millis());
      return TimeUnit.MILLISECONDS.toNanos(remainingMillis);
    }

    @Override
    public long expireAfterUpdate(String key, SessionRecord value, long currentTime, long currentDuration) {
      return currentDuration;
    }

    @Override
    public long expireAfterRead(String key, SessionRecord value, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
