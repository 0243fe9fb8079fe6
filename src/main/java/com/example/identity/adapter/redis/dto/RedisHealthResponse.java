package com.example.identity.adapter.redis.dto;

/**
 * Result of probing the Redis session store.
 */
public record RedisHealthResponse(
    boolean healthy,
    long responseTimeMs,
    String version,
    String error
) {
  public static RedisHealthResponse healthy(long responseTimeMs, String version) {
    return new RedisHealthResponse(true, responseTimeMs, version, null);
  }

  public static RedisHealthResponse unhealthy(long responseTimeMs, String error) {
    return new RedisHealthResponse(false, responseTimeMs, null, error);
  }
}
