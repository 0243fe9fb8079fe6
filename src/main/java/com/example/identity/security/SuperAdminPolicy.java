package com.example.identity.security;

import com.example.identity.properties.ApplicationProperties;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Super admins are the email addresses listed in {@code app.security.super-admins}.
 * Matching is case-insensitive and ignores surrounding whitespace.
 */
@Slf4j
@Component
public class SuperAdminPolicy implements ElevatedAccessPolicy {

  private final Set<String> superAdminEmails;

  public SuperAdminPolicy(ApplicationProperties properties) {
    List<String> configured = properties.security().superAdmins();
    this.superAdminEmails = configured == null ? Set.of() : configured.stream()
        .filter(email -> email != null)
        .map(SuperAdminPolicy::normalize)
        .filter(email -> !email.isEmpty())
        .collect(Collectors.toUnmodifiableSet());
    log.info("Loaded {} super admin address(es)", superAdminEmails.size());
  }

  @Override
  public boolean isElevated(String email) {
    if (email == null || email.isBlank()) {
      return false;
    }
    return superAdminEmails.contains(normalize(email));
  }

  private static String normalize(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }
}
