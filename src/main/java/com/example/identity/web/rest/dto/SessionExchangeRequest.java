package com.example.identity.web.rest.dto;

/**
 * Body form of the session exchange, for clients that cannot set an Authorization header.
 */
public record SessionExchangeRequest(String accessToken) {}
