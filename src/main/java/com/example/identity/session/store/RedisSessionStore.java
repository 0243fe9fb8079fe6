package com.example.identity.session.store;

import com.example.identity.domain.entity.SessionRecord;
import com.example.identity.exception.InvalidSessionException;
import com.example.identity.exception.SessionStoreUnavailableException;
import com.example.identity.properties.ApplicationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/**
 * Session store backed by Redis hashes, one hash per session under {@code <prefix><sessionId>}.
 * Redis evicts each hash at the record's {@code expiresAt}; reads re-check expiry against the clock.
 * Any Redis access failure, command timeouts included, is reported as store unavailability.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.session.store", name = "type", havingValue = "redis")
public class RedisSessionStore implements SessionStore {

  public static final String FIELD_USER_ID = "userId";
  public static final String FIELD_EXTERNAL_SUBJECT = "externalSubject";
  public static final String FIELD_EMAIL = "email";
  public static final String FIELD_DISPLAY_NAME = "displayName";
  public static final String FIELD_TAGS = "tags";
  public static final String FIELD_CREATED_AT = "createdAt";
  public static final String FIELD_EXPIRES_AT = "expiresAt";

  private static final TypeReference<List<String>> TAG_LIST = new TypeReference<>() {};

  private final RedisTemplate<String, String> redisTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final String keyPrefix;

  public RedisSessionStore(
      RedisTemplate<String, String> redisTemplate,
      ObjectMapper objectMapper,
      ApplicationProperties properties,
      Clock clock) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.keyPrefix = properties.session().store().keyPrefix();
  }

  @Override
  public String create(SessionRecord record) {
    long ttlMillis = record.expiresAt() - clock.millis();
    if (ttlMillis <= 0) {
      throw new IllegalArgumentException("Cannot store a session that has already expired");
    }

    String sessionId = SessionIds.generate();
    String sessionKey = keyPrefix + sessionId;
    Map<String, String> sessionData = toHash(record);

    try {
      redisTemplate.executePipelined(new SessionCallback<Object>() {
        @Override
        public Object execute(@NonNull RedisOperations operations) {
          @SuppressWarnings("unchecked")
          RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
          redisOps.opsForHash().putAll(sessionKey, sessionData);
          redisOps.expire(sessionKey, ttlMillis, TimeUnit.MILLISECONDS);
          return null;
        }
      });
    } catch (DataAccessException e) {
      throw new SessionStoreUnavailableException("Redis session store is unreachable", e);
    }

    log.debug("Created Redis session {} with TTL {} ms", SessionIds.mask(sessionId), ttlMillis);
    return sessionId;
  }

  @Override
  public Optional<SessionRecord> get(String sessionId) {
    Map<String, String> sessionData;
    try {
      HashOperations<String, String, String> hashOps = redisTemplate.opsForHash();
      sessionData = hashOps.entries(keyPrefix + sessionId);
    } catch (DataAccessException e) {
      throw new SessionStoreUnavailableException("Redis session store is unreachable", e);
    }

    if (sessionData == null || sessionData.isEmpty()) {
      return Optional.empty();
    }

    SessionRecord record = fromHash(sessionId, sessionData);
    if (record.isExpiredAt(clock.millis())) {
      return Optional.empty();
    }
    return Optional.of(record);
  }

  @Override
  public void delete(String sessionId) {
    try {
      redisTemplate.delete(keyPrefix + sessionId);
    } catch (DataAccessException e) {
      throw new SessionStoreUnavailableException("Redis session store is unreachable", e);
    }
  }

  private Map<String, String> toHash(SessionRecord record) {
    Map<String, String> sessionData = new HashMap<>();
    sessionData.put(FIELD_USER_ID, record.userId());
    sessionData.put(FIELD_EXTERNAL_SUBJECT, record.externalSubject());
    // Redis hashes cannot hold nulls; absent fields read back as null
    if (record.email() != null) {
      sessionData.put(FIELD_EMAIL, record.email());
    }
    if (record.displayName() != null) {
      sessionData.put(FIELD_DISPLAY_NAME, record.displayName());
    }
    sessionData.put(FIELD_CREATED_AT, String.valueOf(record.createdAt()));
    sessionData.put(FIELD_EXPIRES_AT, String.valueOf(record.expiresAt()));
    try {
      sessionData.put(FIELD_TAGS, objectMapper.writeValueAsString(record.tags()));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize session tags", e);
    }
    return sessionData;
  }

  private SessionRecord fromHash(String sessionId, Map<String, String> sessionData) {
    try {
      String tags = sessionData.get(FIELD_TAGS);
      return new SessionRecord(
          sessionId,
          sessionData.get(FIELD_USER_ID),
          sessionData.get(FIELD_EXTERNAL_SUBJECT),
          sessionData.get(FIELD_EMAIL),
          sessionData.get(FIELD_DISPLAY_NAME),
          tags == null ? List.of() : objectMapper.readValue(tags, TAG_LIST),
          Long.parseLong(sessionData.get(FIELD_CREATED_AT)),
          Long.parseLong(sessionData.get(FIELD_EXPIRES_AT)));
    } catch (JsonProcessingException | NumberFormatException e) {
      throw new InvalidSessionException("Stored session " + SessionIds.mask(sessionId) + " is corrupt", e);
    }
  }
}
