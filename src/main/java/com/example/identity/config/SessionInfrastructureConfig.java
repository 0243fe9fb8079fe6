package com.example.identity.config;

import java.time.Clock;
import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Shared infrastructure for session resolution.
 */
@Configuration(proxyBeanMethods = false)
public class SessionInfrastructureConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Runs user directory lookups so resolution can bound them with a timeout
   */
  @Bean(name = "directoryLookupExecutor")
  public Executor directoryLookupExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("directory-lookup-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
