package com.example.identity.security;

/**
 * Decides elevated-privilege membership from current directory state.
 * Always evaluated at resolution time, never cached on the session.
 */
public interface ElevatedAccessPolicy {

  boolean isElevated(String email);
}
