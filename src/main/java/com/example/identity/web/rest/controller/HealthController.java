package com.example.identity.web.rest.controller;

import com.example.identity.adapter.redis.client.RedisHealthClient;
import com.example.identity.adapter.redis.dto.RedisHealthResponse;
import com.example.identity.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Health Check Controller
 *
 * Health endpoints return their own status codes and never go through GlobalErrorHandler.
 * Readiness does not depend on the store when it is in-memory or disabled, since sessions then
 * resolve from self-contained tokens.
 */
@Slf4j
@RestController
public class HealthController implements HealthAPI {

  private static final double MEMORY_USAGE_CRITICAL_PERCENT = 90.0;
  private static final String STATUS_UP = "UP";
  private static final String STATUS_DOWN = "DOWN";
  private static final String STATUS_LIVE = "LIVE";
  private static final String STATUS_DEAD = "DEAD";

  private final ObjectProvider<RedisHealthClient> redisHealthClient;
  private final ApplicationProperties properties;
  private final Clock clock;

  public HealthController(ObjectProvider<RedisHealthClient> redisHealthClient,
                          ApplicationProperties properties,
                          Clock clock) {
    this.redisHealthClient = redisHealthClient;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of(
        "status", STATUS_UP,
        "timestamp", clock.millis()
                                   ));
  }

  /**
   * Liveness probe - checks JVM health
   */
  @Override
  public ResponseEntity<Map<String, Object>> liveness() {
    Runtime runtime = Runtime.getRuntime();
    long usedMemory = runtime.totalMemory() - runtime.freeMemory();
    double memoryUsagePercent = (double) usedMemory / runtime.maxMemory() * 100;

    Map<String, Object> response = new HashMap<>();
    response.put("memoryUsagePercent", String.format("%.2f", memoryUsagePercent));

    if (memoryUsagePercent < MEMORY_USAGE_CRITICAL_PERCENT) {
      response.put("status", STATUS_LIVE);
      return ResponseEntity.ok(response);
    }

    log.warn("Liveness check failed: memory usage {}%", memoryUsagePercent);
    response.put("status", STATUS_DEAD);
    return ResponseEntity.status(503).body(response);
  }

  /**
   * Readiness probe - checks the session store backend
   */
  @Override
  public ResponseEntity<Map<String, Object>> readiness() {
    Map<String, Object> store = new HashMap<>();
    store.put("type", properties.session().store().type());

    boolean isReady = true;
    RedisHealthClient client = redisHealthClient.getIfAvailable();
    if (client != null) {
      RedisHealthResponse redisHealth = client.checkHealth();
      store.put("status", redisHealth.healthy() ? STATUS_UP : STATUS_DOWN);
      store.put("responseTimeMs", redisHealth.responseTimeMs());
      if (redisHealth.version() != null) {
        store.put("version", redisHealth.version());
      }
      if (!redisHealth.healthy()) {
        isReady = false;
        log.warn("Readiness check failed: Redis session store unreachable ({})", redisHealth.error());
      }
    } else {
      store.put("status", STATUS_UP);
    }

    Map<String, Object> status = new HashMap<>();
    status.put("sessionStore", store);
    status.put("ready", isReady);
    status.put("timestamp", clock.millis());

    return ResponseEntity.status(isReady ? 200 : 503).body(status);
  }
}
