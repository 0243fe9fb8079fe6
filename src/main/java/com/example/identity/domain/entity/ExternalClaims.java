package com.example.identity.domain.entity;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Claims returned by the external identity provider for an access token.
 *
 * @param tags the raw tags claim exactly as received; may be null, a JSON array,
 *             or a string (itself possibly JSON-encoded)
 */
public record ExternalClaims(
    String subject,
    String email,
    String displayName,
    JsonNode tags
) {}
