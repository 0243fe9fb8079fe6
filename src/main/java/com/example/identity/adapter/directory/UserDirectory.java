package com.example.identity.adapter.directory;

import com.example.identity.domain.entity.DirectoryUser;
import java.util.Optional;

/**
 * The local user directory that owns identity records.
 */
public interface UserDirectory {

  /**
   * Existence check used on every session resolution.
   */
  Optional<DirectoryUser> findById(String id);

  /**
   * Used only when a session is created. Matches on external subject, then on email; refreshes
   * email and display name when new non-null values are supplied.
   */
  DirectoryUser findOrCreate(String externalSubject, String email, String displayName);
}
