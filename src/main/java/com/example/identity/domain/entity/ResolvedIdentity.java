package com.example.identity.domain.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Canonical identity handed to callers once a session has been resolved and verified.
 * {@code email} and {@code displayName} come from the current directory record; {@code elevated}
 * is derived at resolution time.
 */
public record ResolvedIdentity(
    String id,
    String externalSubject,
    String email,
    String displayName,
    List<String> tags,
    @JsonProperty("isElevated") boolean elevated
) {

  public ResolvedIdentity {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }
}
