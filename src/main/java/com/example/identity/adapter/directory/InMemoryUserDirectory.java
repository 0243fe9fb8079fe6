package com.example.identity.adapter.directory;

import com.example.identity.domain.entity.DirectoryUser;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Process-local directory used when no relational directory adapter is wired in.
 * Entries are lost on restart.
 */
@Slf4j
@Component
public class InMemoryUserDirectory implements UserDirectory {

  private final Map<String, DirectoryUser> usersById = new ConcurrentHashMap<>();

  @Override
  public Optional<DirectoryUser> findById(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(usersById.get(id));
  }

  @Override
  public synchronized DirectoryUser findOrCreate(String externalSubject, String email, String displayName) {
    Optional<DirectoryUser> existing = usersById.values().stream()
        .filter(user -> externalSubject.equals(user.externalSubject()))
        .findFirst()
        .or(() -> email == null ? Optional.empty() : usersById.values().stream()
            .filter(user -> email.equalsIgnoreCase(user.email()))
            .findFirst());

    DirectoryUser user = existing
        .map(found -> new DirectoryUser(
            found.id(),
            found.externalSubject(),
            email != null ? email : found.email(),
            displayName != null ? displayName : found.displayName()))
        .orElseGet(() -> new DirectoryUser(UUID.randomUUID().toString(), externalSubject, email, displayName));

    usersById.put(user.id(), user);
    if (existing.isEmpty()) {
      log.info("Created directory user {} for external subject", user.id());
    }
    return user;
  }
}
