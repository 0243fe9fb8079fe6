package com.example.identity;

import com.example.identity.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Session and identity resolution service.
 * Redis is configured by {@code RedisConfig} only when the redis session store is selected.
 */
@SpringBootApplication(exclude = {
    RedisAutoConfiguration.class,
    RedisRepositoriesAutoConfiguration.class
})
@EnableConfigurationProperties(ApplicationProperties.class)
public class IdentitySessionApplication {

  public static void main(String[] args) {
    SpringApplication.run(IdentitySessionApplication.class, args);
  }
}
