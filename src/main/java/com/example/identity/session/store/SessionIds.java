package com.example.identity.session.store;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Generation and shape checks for store session identifiers.
 * An identifier is 32 random bytes, lowercase hex encoded.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class SessionIds {

  public static final int SESSION_ID_ENTROPY_BYTES = 32;
  public static final int SESSION_ID_LENGTH = SESSION_ID_ENTROPY_BYTES * 2;

  private static final Pattern SESSION_ID_PATTERN = Pattern.compile("^[0-9a-f]{" + SESSION_ID_LENGTH + "}$");
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();
  private static final HexFormat HEX = HexFormat.of();

  public static String generate() {
    byte[] randomBytes = new byte[SESSION_ID_ENTROPY_BYTES];
    SECURE_RANDOM.nextBytes(randomBytes);
    return HEX.formatHex(randomBytes);
  }

  /**
   * True when the candidate has the exact shape of a store identifier. A self-contained token
   * never has this shape, so the check splits candidates into two disjoint classes.
   */
  public static boolean isStoreId(String candidate) {
    return candidate != null && SESSION_ID_PATTERN.matcher(candidate).matches();
  }

  public static String mask(String sessionId) {
    if (sessionId == null || sessionId.length() < 8) return "INVALID";
    return sessionId.substring(0, 8) + "...";
  }
}
