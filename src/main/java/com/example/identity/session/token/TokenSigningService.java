package com.example.identity.session.token;

import com.example.identity.properties.ApplicationProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * HMAC-SHA256 signing of self-contained session tokens.
 *
 * The key is read once from configuration; it is static, so verifying a token needs no
 * server-side session state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenSigningService {

  public static final int MIN_KEY_BYTES = 32;
  private static final String SIGNING_ALGORITHM = "HmacSHA256";

  private final ApplicationProperties properties;

  private volatile SecretKey signingKey;

  @PostConstruct
  public void initialize() {
    loadSigningKey();
  }

  /**
   * Sign the payload, returning a base64url signature without padding
   */
  public String sign(String payload) {
    return Base64.getUrlEncoder().withoutPadding().encodeToString(mac(payload));
  }

  /**
   * Constant-time comparison of the expected signature with the presented one
   */
  public boolean verify(String payload, String signature) {
    if (signature == null || signature.isEmpty()) {
      return false;
    }
    byte[] presented;
    try {
      presented = Base64.getUrlDecoder().decode(signature);
    } catch (IllegalArgumentException e) {
      return false;
    }
    return MessageDigest.isEqual(mac(payload), presented);
  }

  private byte[] mac(String payload) {
    try {
      Mac mac = Mac.getInstance(SIGNING_ALGORITHM);
      mac.init(getSigningKey());
      return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
    } catch (GeneralSecurityException e) {
      log.error("Token signing failed", e);
      throw new IllegalStateException("Failed to sign session token", e);
    }
  }

  private SecretKey getSigningKey() {
    if (signingKey == null) {
      synchronized (this) {
        if (signingKey == null) {
          loadSigningKey();
        }
      }
    }
    return signingKey;
  }

  private void loadSigningKey() {
    byte[] keyBytes;
    try {
      keyBytes = Base64.getDecoder().decode(properties.session().token().signingKey().trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Session token signing key is not valid base64", e);
    }
    if (keyBytes.length < MIN_KEY_BYTES) {
      throw new IllegalStateException("Session token signing key must be at least 256 bits");
    }
    signingKey = new SecretKeySpec(keyBytes, SIGNING_ALGORITHM);
    log.info("Session token signing key loaded");
  }
}
