package com.example.identity.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Normalizes the identity provider's tags claim into an ordered list of strings.
 *
 * <p>Accepted shapes: absent or null, a native array, a string holding a JSON array, a string
 * holding a JSON string, or a bare string ({@code "editor"} becomes {@code ["editor"]}). Objects, and
 * strings holding JSON {@code null} or an object, carry no tags.
 * Applied once when a session is created; sessions only ever carry the normalized list.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class TagsNormalizer {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static List<String> normalize(JsonNode claim) {
    if (claim == null || claim.isNull() || claim.isMissingNode()) {
      return List.of();
    }
    if (claim.isArray()) {
      return fromArray(claim);
    }
    if (claim.isTextual()) {
      return fromText(claim.asText());
    }
    if (claim.isObject()) {
      return List.of();
    }
    return List.of(claim.asText());
  }

  private static List<String> fromText(String text) {
    if (text.isBlank()) {
      return List.of();
    }
    JsonNode parsed;
    try {
      parsed = MAPPER.readTree(text);
    } catch (JsonProcessingException e) {
      return List.of(text);
    }
    if (parsed == null || parsed.isNull() || parsed.isMissingNode() || parsed.isObject()) {
      return List.of();
    }
    if (parsed.isArray()) {
      return fromArray(parsed);
    }
    if (parsed.isTextual()) {
      return parsed.asText().isBlank() ? List.of() : List.of(parsed.asText());
    }
    return List.of(text);
  }

  private static List<String> fromArray(JsonNode array) {
    List<String> tags = new ArrayList<>(array.size());
    for (JsonNode element : array) {
      if (element == null || element.isNull()) {
        continue;
      }
      tags.add(element.isTextual() ? element.asText() : element.toString());
    }
    return List.copyOf(tags);
  }
}
