package com.example.identity.session.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.identity.domain.entity.SessionRecord;
import com.example.identity.exception.InvalidSessionException;
import com.example.identity.exception.SessionStoreUnavailableException;
import com.example.identity.support.MutableClock;
import com.example.identity.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;

@DisplayName("RedisSessionStore")
@SuppressWarnings({"unchecked", "rawtypes"})
class RedisSessionStoreTest {

  private static final long NOW = 1_700_000_000_000L;
  private static final long TTL_MILLIS = 3_600_000L;

  private RedisTemplate<String, String> redisTemplate;
  private HashOperations<String, String, String> hashOps;
  private MutableClock clock;
  private RedisSessionStore store;

  @BeforeEach
  void setUp() {
    redisTemplate = mock(RedisTemplate.class);
    hashOps = mock(HashOperations.class);
    doReturn(hashOps).when(redisTemplate).opsForHash();
    clock = MutableClock.startingAt(NOW);
    store = new RedisSessionStore(redisTemplate, new ObjectMapper(), TestProperties.defaults(), clock);
  }

  private static SessionRecord record(String email) {
    return new SessionRecord(null, "user-1", "sub-1", email, "Ada",
                             List.of("editor", "viewer"), NOW, NOW + TTL_MILLIS);
  }

  private static Map<String, String> storedHash() {
    Map<String, String> hash = new HashMap<>();
    hash.put(RedisSessionStore.FIELD_USER_ID, "user-1");
    hash.put(RedisSessionStore.FIELD_EXTERNAL_SUBJECT, "sub-1");
    hash.put(RedisSessionStore.FIELD_EMAIL, "ada@example.com");
    hash.put(RedisSessionStore.FIELD_TAGS, "[\"editor\",\"viewer\"]");
    hash.put(RedisSessionStore.FIELD_CREATED_AT, String.valueOf(NOW));
    hash.put(RedisSessionStore.FIELD_EXPIRES_AT, String.valueOf(NOW + TTL_MILLIS));
    return hash;
  }

  @Nested
  @DisplayName("create")
  class Create {

    @Test
    @DisplayName("should write the hash and expire it at expiresAt in one pipeline")
    void shouldWriteHashWithExpiry() {
      String id = store.create(record("ada@example.com"));

      ArgumentCaptor<SessionCallback> callback = ArgumentCaptor.forClass(SessionCallback.class);
      verify(redisTemplate).executePipelined(callback.capture());

      RedisOperations<String, String> operations = mock(RedisOperations.class);
      HashOperations<String, Object, Object> pipelinedHashOps = mock(HashOperations.class);
      doReturn(pipelinedHashOps).when(operations).opsForHash();
      callback.getValue().execute(operations);

      ArgumentCaptor<Map> written = ArgumentCaptor.forClass(Map.class);
      verify(pipelinedHashOps).putAll(eq("session:" + id), written.capture());
      verify(operations).expire("session:" + id, TTL_MILLIS, TimeUnit.MILLISECONDS);

      Map<String, String> hash = written.getValue();
      assertEquals("user-1", hash.get(RedisSessionStore.FIELD_USER_ID));
      assertEquals("[\"editor\",\"viewer\"]", hash.get(RedisSessionStore.FIELD_TAGS));
      assertEquals(String.valueOf(NOW + TTL_MILLIS), hash.get(RedisSessionStore.FIELD_EXPIRES_AT));
      assertTrue(SessionIds.isStoreId(id));
    }

    @Test
    @DisplayName("should omit null fields from the hash")
    void shouldOmitNullFields() {
      String id = store.create(record(null));

      ArgumentCaptor<SessionCallback> callback = ArgumentCaptor.forClass(SessionCallback.class);
      verify(redisTemplate).executePipelined(callback.capture());
      RedisOperations<String, String> operations = mock(RedisOperations.class);
      HashOperations<String, Object, Object> pipelinedHashOps = mock(HashOperations.class);
      doReturn(pipelinedHashOps).when(operations).opsForHash();
      callback.getValue().execute(operations);

      ArgumentCaptor<Map> written = ArgumentCaptor.forClass(Map.class);
      verify(pipelinedHashOps).putAll(eq("session:" + id), written.capture());
      assertFalse(written.getValue().containsKey(RedisSessionStore.FIELD_EMAIL));
    }

    @Test
    @DisplayName("should report unavailability when Redis is unreachable")
    void shouldReportUnavailability() {
      when(redisTemplate.executePipelined(any(SessionCallback.class)))
          .thenThrow(new RedisConnectionFailureException("connection refused"));

      assertThrows(SessionStoreUnavailableException.class, () -> store.create(record("ada@example.com")));
    }

    @Test
    @DisplayName("should refuse records that are already expired")
    void shouldRefuseExpiredRecords() {
      clock.advance(Duration.ofMillis(TTL_MILLIS));

      assertThrows(IllegalArgumentException.class, () -> store.create(record("ada@example.com")));
    }
  }

  @Nested
  @DisplayName("get")
  class Get {

    @Test
    @DisplayName("should rebuild the record from its hash")
    void shouldRebuildRecord() {
      String id = SessionIds.generate();
      when(hashOps.entries("session:" + id)).thenReturn(storedHash());

      Optional<SessionRecord> found = store.get(id);

      assertTrue(found.isPresent());
      assertEquals(id, found.get().sessionId());
      assertEquals("sub-1", found.get().externalSubject());
      assertEquals(List.of("editor", "viewer"), found.get().tags());
      assertNull(found.get().displayName());
    }

    @Test
    @DisplayName("should return empty when the hash does not exist")
    void shouldReturnEmptyWhenMissing() {
      String id = SessionIds.generate();
      when(hashOps.entries("session:" + id)).thenReturn(Map.of());

      assertTrue(store.get(id).isEmpty());
    }

    @Test
    @DisplayName("should return empty when Redis has not yet evicted an expired hash")
    void shouldReturnEmptyWhenExpired() {
      String id = SessionIds.generate();
      when(hashOps.entries("session:" + id)).thenReturn(storedHash());
      clock.advance(Duration.ofMillis(TTL_MILLIS));

      assertTrue(store.get(id).isEmpty());
    }

    @Test
    @DisplayName("should fail hard on a corrupt hash")
    void shouldFailOnCorruptHash() {
      String id = SessionIds.generate();
      Map<String, String> corrupt = storedHash();
      corrupt.put(RedisSessionStore.FIELD_CREATED_AT, "yesterday");
      when(hashOps.entries("session:" + id)).thenReturn(corrupt);

      assertThrows(InvalidSessionException.class, () -> store.get(id));
    }

    @Test
    @DisplayName("should report unavailability distinctly from absence")
    void shouldReportUnavailability() {
      when(hashOps.entries(anyString())).thenThrow(new RedisConnectionFailureException("timeout"));

      assertThrows(SessionStoreUnavailableException.class, () -> store.get(SessionIds.generate()));
    }
  }

  @Nested
  @DisplayName("delete")
  class Delete {

    @Test
    @DisplayName("should delete the prefixed key")
    void shouldDeletePrefixedKey() {
      String id = SessionIds.generate();

      store.delete(id);

      verify(redisTemplate).delete("session:" + id);
    }

    @Test
    @DisplayName("should report unavailability")
    void shouldReportUnavailability() {
      when(redisTemplate.delete(anyString())).thenThrow(new RedisConnectionFailureException("down"));

      assertThrows(SessionStoreUnavailableException.class, () -> store.delete(SessionIds.generate()));
    }
  }
}
