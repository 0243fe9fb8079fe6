package com.example.identity.session.token;

import com.example.identity.domain.entity.SessionRecord;
import com.example.identity.exception.MalformedTokenException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Encodes session records as self-contained tokens and decodes them back.
 *
 * <p>A token is the base64url (unpadded) form of a signed JSON envelope
 * {@code {"session":{...},"sig":"..."}}. Decoding first tries that canonical form and then the bare
 * JSON envelope, which is what remains when an intermediary stored the value without the outer
 * base64 layer. The codec checks structure and signature only; expiry is the caller's concern.
 * The store identifier is never embedded, so the token and the store entry stay independent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionTokenCodec {

  // Fixed configuration so the signed bytes do not depend on the application's ObjectMapper
  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
      .build();

  private final TokenSigningService signingService;

  public String encode(SessionRecord record) {
    if (!record.isWellFormed()) {
      throw new IllegalArgumentException("Cannot encode a session without identity or lifetime");
    }
    TokenPayload payload = new TokenPayload(
        record.userId(),
        record.externalSubject(),
        record.email(),
        record.displayName(),
        record.tags(),
        record.createdAt(),
        record.expiresAt());
    try {
      String signature = signingService.sign(MAPPER.writeValueAsString(payload));
      byte[] envelope = MAPPER.writeValueAsBytes(new TokenEnvelope(payload, signature));
      return Base64.getUrlEncoder().withoutPadding().encodeToString(envelope);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize session token", e);
    }
  }

  /**
   * @throws MalformedTokenException when neither decoding attempt yields a signed, well-formed record
   */
  public SessionRecord decode(String token) {
    if (token == null || token.isBlank()) {
      throw new MalformedTokenException("Session token is empty");
    }
    String candidate = token.trim();

    TokenEnvelope envelope = readCanonical(candidate)
        .or(() -> readEnvelope(candidate))
        .orElseThrow(() -> new MalformedTokenException("Session token is not decodable"));

    TokenPayload payload = envelope.session();
    try {
      if (!signingService.verify(MAPPER.writeValueAsString(payload), envelope.sig())) {
        throw new MalformedTokenException("Session token signature does not match");
      }
    } catch (JsonProcessingException e) {
      throw new MalformedTokenException("Session token payload cannot be serialized", e);
    }

    List<String> tags = payload.tags() == null
        ? List.of()
        : payload.tags().stream().filter(Objects::nonNull).toList();
    SessionRecord record = new SessionRecord(
        null,
        payload.userId(),
        payload.subject(),
        payload.email(),
        payload.name(),
        tags,
        payload.createdAt(),
        payload.expiresAt());
    if (!record.isWellFormed()) {
      throw new MalformedTokenException("Session token is missing identity or lifetime");
    }
    return record;
  }

  private Optional<TokenEnvelope> readCanonical(String token) {
    byte[] json;
    try {
      json = Base64.getUrlDecoder().decode(toUrlAlphabet(token));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
    return readEnvelope(new String(json, StandardCharsets.UTF_8));
  }

  private Optional<TokenEnvelope> readEnvelope(String json) {
    try {
      return Optional.ofNullable(MAPPER.readValue(json, TokenEnvelope.class))
          .filter(envelope -> envelope.session() != null);
    } catch (JsonProcessingException e) {
      log.trace("Token is not a JSON session envelope: {}", e.getOriginalMessage());
      return Optional.empty();
    }
  }

  // Accept the standard base64 alphabet, padding, and '+' already form-decoded to ' '
  private static String toUrlAlphabet(String token) {
    String urlSafe = token.replace(' ', '-').replace('+', '-').replace('/', '_');
    int end = urlSafe.length();
    while (end > 0 && urlSafe.charAt(end - 1) == '=') {
      end--;
    }
    return urlSafe.substring(0, end);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TokenPayload(
      String userId,
      String subject,
      String email,
      String name,
      List<String> tags,
      long createdAt,
      long expiresAt
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TokenEnvelope(
      TokenPayload session,
      String sig
  ) {}
}
