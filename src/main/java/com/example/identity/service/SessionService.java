package com.example.identity.service;

import com.example.identity.adapter.directory.UserDirectory;
import com.example.identity.domain.entity.DirectoryUser;
import com.example.identity.domain.entity.ResolvedIdentity;
import com.example.identity.domain.entity.SessionRecord;
import com.example.identity.exception.InvalidSessionException;
import com.example.identity.exception.MalformedTokenException;
import com.example.identity.exception.SessionStoreUnavailableException;
import com.example.identity.exception.UnauthorizedException;
import com.example.identity.properties.ApplicationProperties;
import com.example.identity.security.ElevatedAccessPolicy;
import com.example.identity.session.resolver.SessionTokenResolver;
import com.example.identity.session.store.SessionIds;
import com.example.identity.session.store.SessionStore;
import com.example.identity.session.token.SessionTokenCodec;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Turns an inbound request into a verified, expiry-checked identity.
 *
 * <p>The credential found by {@link SessionTokenResolver} is classified once: a value shaped like a
 * store identifier is looked up in the {@link SessionStore}, anything else is decoded by the
 * {@link SessionTokenCodec}. Both paths then pass the same expiry and directory checks, so an
 * identity is valid or not regardless of which path produced it.
 *
 * <p>Every "not authenticated" outcome (no credential, malformed token, store unavailable, unknown
 * or expired session, deleted user) is an empty result and never an exception. Only a server-side
 * record that breaks its own invariants raises {@link InvalidSessionException}.
 */
@Service
@Slf4j
public class SessionService {

  private final SessionTokenResolver tokenResolver;
  private final SessionStore sessionStore;
  private final SessionTokenCodec tokenCodec;
  private final UserDirectory userDirectory;
  private final ElevatedAccessPolicy elevatedAccessPolicy;
  private final Executor directoryLookupExecutor;
  private final Duration directoryTimeout;
  private final Clock clock;

  public SessionService(
      SessionTokenResolver tokenResolver,
      SessionStore sessionStore,
      SessionTokenCodec tokenCodec,
      UserDirectory userDirectory,
      ElevatedAccessPolicy elevatedAccessPolicy,
      @Qualifier("directoryLookupExecutor") Executor directoryLookupExecutor,
      ApplicationProperties properties,
      Clock clock) {
    this.tokenResolver = tokenResolver;
    this.sessionStore = sessionStore;
    this.tokenCodec = tokenCodec;
    this.userDirectory = userDirectory;
    this.elevatedAccessPolicy = elevatedAccessPolicy;
    this.directoryLookupExecutor = directoryLookupExecutor;
    this.directoryTimeout = properties.session().directoryTimeout();
    this.clock = clock;
  }

  /**
   * Resolves the session carried by the request.
   *
   * @return the identity, or empty when the request is not authenticated
   * @throws InvalidSessionException when the store returns a record violating its invariants
   */
  public Optional<ResolvedIdentity> resolve(HttpServletRequest request) {
    return tokenResolver.resolve(request).flatMap(this::resolveCandidate);
  }

  /**
   * Resolves a raw credential as found in any transport.
   */
  public Optional<ResolvedIdentity> resolveCandidate(String candidate) {
    Optional<SessionRecord> record = SessionIds.isStoreId(candidate)
        ? lookupStoreReference(candidate)
        : decodeSelfContained(candidate);

    return record
        .filter(this::isLive)
        .flatMap(this::toResolvedIdentity);
  }

  /**
   * Exception-style wrapper over {@link #resolve(HttpServletRequest)} for callers that want an
   * early exit.
   *
   * @throws UnauthorizedException when the request is not authenticated
   */
  public ResolvedIdentity requireSession(HttpServletRequest request) {
    return resolve(request).orElseThrow(() -> new UnauthorizedException("Unauthorized"));
  }

  private Optional<SessionRecord> lookupStoreReference(String sessionId) {
    Optional<SessionRecord> record;
    try {
      record = sessionStore.get(sessionId);
    } catch (SessionStoreUnavailableException e) {
      // A store-id-shaped value is never token data, so there is nothing to fall back to
      log.warn("Session store unavailable while resolving session {}: {}",
               SessionIds.mask(sessionId), e.getMessage());
      return Optional.empty();
    }

    if (record.isEmpty()) {
      log.debug("Session {} not found in store", SessionIds.mask(sessionId));
      return Optional.empty();
    }
    if (!record.get().isWellFormed()) {
      throw new InvalidSessionException("Stored session " + SessionIds.mask(sessionId) + " violates record invariants");
    }
    return record;
  }

  private Optional<SessionRecord> decodeSelfContained(String token) {
    try {
      return Optional.of(tokenCodec.decode(token));
    } catch (MalformedTokenException e) {
      log.debug("Ignoring malformed session token: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private boolean isLive(SessionRecord record) {
    if (record.isExpiredAt(clock.millis())) {
      log.debug("Session for user {} expired at {}", record.userId(), record.expiresAt());
      return false;
    }
    return true;
  }

  private Optional<ResolvedIdentity> toResolvedIdentity(SessionRecord record) {
    Optional<DirectoryUser> user = findDirectoryUser(record.userId());
    if (user.isEmpty()) {
      log.debug("Session references user {} which no longer resolves", record.userId());
      return Optional.empty();
    }

    DirectoryUser current = user.get();
    return Optional.of(new ResolvedIdentity(
        current.id(),
        current.externalSubject(),
        current.email(),
        current.displayName(),
        record.tags(),
        elevatedAccessPolicy.isElevated(current.email())));
  }

  private Optional<DirectoryUser> findDirectoryUser(String userId) {
    // A timed-out lookup is interrupted so it releases its worker
    FutureTask<Optional<DirectoryUser>> lookup = new FutureTask<>(() -> userDirectory.findById(userId));
    try {
      directoryLookupExecutor.execute(lookup);
    } catch (RejectedExecutionException e) {
      log.warn("User directory lookup rejected, executor saturated: {}", e.getMessage());
      return Optional.empty();
    }

    try {
      return lookup.get(directoryTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      lookup.cancel(true);
      log.warn("User directory lookup timed out after {} ms", directoryTimeout.toMillis());
      return Optional.empty();
    } catch (ExecutionException e) {
      log.error("User directory lookup failed", e.getCause());
      return Optional.empty();
    } catch (InterruptedException e) {
      lookup.cancel(true);
      Thread.currentThread().interrupt();
      log.warn("Interrupted during user directory lookup");
      return Optional.empty();
    }
  }
}
