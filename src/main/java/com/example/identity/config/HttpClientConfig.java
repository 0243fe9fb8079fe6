package com.example.identity.config;

import com.example.identity.properties.ApplicationProperties;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp client configuration for identity provider calls.
 * One shared connection pool and dispatcher.
 */
@Configuration
public class HttpClientConfig {

  @Bean
  public ConnectionPool sharedConnectionPool(ApplicationProperties properties) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return new ConnectionPool(client.maxIdleConnections(), client.keepAliveDurationMinutes(), TimeUnit.MINUTES);
  }

  @Bean
  public Dispatcher sharedDispatcher(ApplicationProperties properties) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    Dispatcher dispatcher = new Dispatcher();
    dispatcher.setMaxRequests(client.maxRequests());
    dispatcher.setMaxRequestsPerHost(client.maxRequestsPerHost());
    return dispatcher;
  }

  /**
   * Client used for the userinfo exchange; redirects are never followed with a bearer token attached
   */
  @Bean
  public OkHttpClient defaultOkHttpClient(ConnectionPool connectionPool, Dispatcher dispatcher) {
    return new OkHttpClient.Builder()
        .connectionPool(connectionPool)
        .dispatcher(dispatcher)
        .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
        .connectTimeout(3, TimeUnit.SECONDS)
        .readTimeout(5, TimeUnit.SECONDS)
        .writeTimeout(5, TimeUnit.SECONDS)
        .retryOnConnectionFailure(true)
        .followRedirects(false)
        .followSslRedirects(false)
        .build();
  }
}
