package com.example.identity.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.identity.adapter.directory.InMemoryUserDirectory;
import com.example.identity.domain.entity.IssuedSession;
import com.example.identity.domain.entity.SessionRecord;
import com.example.identity.exception.SessionStoreUnavailableException;
import com.example.identity.properties.ApplicationProperties;
import com.example.identity.session.store.InMemorySessionStore;
import com.example.identity.session.store.SessionIds;
import com.example.identity.session.store.SessionStore;
import com.example.identity.session.token.SessionTokenCodec;
import com.example.identity.session.token.TokenSigningService;
import com.example.identity.support.MutableClock;
import com.example.identity.support.TestProperties;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SessionLifecycleService")
class SessionLifecycleServiceTest {

  private static final long NOW = 1_700_000_000_000L;

  private ApplicationProperties properties;
  private MutableClock clock;
  private InMemorySessionStore store;
  private SessionTokenCodec codec;
  private InMemoryUserDirectory directory;
  private SessionLifecycleService lifecycle;

  @BeforeEach
  void setUp() {
    properties = TestProperties.defaults();
    clock = MutableClock.startingAt(NOW);
    store = new InMemorySessionStore(properties, clock);
    codec = new SessionTokenCodec(new TokenSigningService(properties));
    directory = new InMemoryUserDirectory();
    lifecycle = new SessionLifecycleService(directory, store, codec, properties, clock);
  }

  @Nested
  @DisplayName("create")
  class Create {

    @Test
    @DisplayName("should issue a store reference and a token for the same record")
    void issuesBothHalves() {
      IssuedSession session = lifecycle.create("sub-1", "ada@example.com", "Ada", List.of("editor"));

      assertTrue(session.hasStoreReference());
      assertTrue(SessionIds.isStoreId(session.sessionId()));
      assertEquals(NOW + TestProperties.TTL.toMillis(), session.expiresAt());

      SessionRecord stored = store.get(session.sessionId()).orElseThrow();
      SessionRecord decoded = codec.decode(session.token());
      assertEquals(stored.userId(), decoded.userId());
      assertEquals(stored.expiresAt(), decoded.expiresAt());
      assertEquals(List.of("editor"), decoded.tags());
      assertNull(decoded.sessionId());
    }

    @Test
    @DisplayName("should reuse the directory user across logins")
    void reusesDirectoryUser() {
      IssuedSession first = lifecycle.create("sub-1", "ada@example.com", "Ada", List.of());
      IssuedSession second = lifecycle.create("sub-1", "ada@example.com", "Ada", List.of());

      assertEquals(codec.decode(first.token()).userId(), codec.decode(second.token()).userId());
      assertFalse(first.sessionId().equals(second.sessionId()));
    }

    @Test
    @DisplayName("should issue a token-only session when the store is unavailable")
    void tokenOnlyWhenStoreDown() {
      SessionStore downStore = mock(SessionStore.class);
      when(downStore.create(any())).thenThrow(new SessionStoreUnavailableException("down"));
      SessionLifecycleService service =
          new SessionLifecycleService(directory, downStore, codec, properties, clock);

      IssuedSession session = service.create("sub-1", "ada@example.com", "Ada", List.of());

      assertFalse(session.hasStoreReference());
      assertNotNull(session.token());
      assertEquals("sub-1", codec.decode(session.token()).externalSubject());
    }

    @Test
    @DisplayName("should reject a blank external subject")
    void rejectsBlankSubject() {
      assertThrows(IllegalArgumentException.class,
                   () -> lifecycle.create(" ", "ada@example.com", "Ada", List.of()));
    }
  }

  @Nested
  @DisplayName("destroy")
  class Destroy {

    @Test
    @DisplayName("should delete a store-backed session")
    void deletesStoreSession() {
      IssuedSession session = lifecycle.create("sub-1", "ada@example.com", "Ada", List.of());

      lifecycle.destroy(session.sessionId());

      assertTrue(store.get(session.sessionId()).isEmpty());
    }

    @Test
    @DisplayName("should not touch the store for a self-contained token")
    void ignoresTokens() {
      SessionStore mockStore = mock(SessionStore.class);
      SessionLifecycleService service =
          new SessionLifecycleService(directory, mockStore, codec, properties, clock);

      service.destroy("not-a-store-id");
      service.destroy(null);

      verify(mockStore, never()).delete(anyString());
    }

    @Test
    @DisplayName("should not fail when the store is unavailable")
    void toleratesStoreOutage() {
      SessionStore downStore = mock(SessionStore.class);
      String sessionId = SessionIds.generate();
      doThrow(new SessionStoreUnavailableException("down")).when(downStore).delete(sessionId);
      SessionLifecycleService service =
          new SessionLifecycleService(directory, downStore, codec, properties, clock);

      service.destroy(sessionId);

      verify(downStore).delete(sessionId);
    }
  }
}
