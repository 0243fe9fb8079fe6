package com.example.identity.adapter.redis.client;

import com.example.identity.adapter.redis.dto.RedisHealthResponse;
import java.time.Clock;
import java.util.Properties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness probe for the Redis session store.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.session.store", name = "type", havingValue = "redis")
@RequiredArgsConstructor
public class RedisHealthClient {

  private static final String PONG = "PONG";

  private final RedisTemplate<String, String> redisTemplate;
  private final Clock clock;

  public RedisHealthResponse checkHealth() {
    long startTime = clock.millis();

    try {
      String pingResponse = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
      if (!PONG.equalsIgnoreCase(pingResponse)) {
        return RedisHealthResponse.unhealthy(clock.millis() - startTime, "Unexpected PING response: " + pingResponse);
      }

      Properties info = redisTemplate.execute((RedisCallback<Properties>) connection -> connection.serverCommands().info("server"));
      String version = info != null ? info.getProperty("redis_version", "unknown") : "unknown";

      return RedisHealthResponse.healthy(clock.millis() - startTime, version);

    } catch (DataAccessException e) {
      log.warn("Redis health check failed: {}", e.getMessage());
      return RedisHealthResponse.unhealthy(clock.millis() - startTime, e.getMessage());
    }
  }
}
