package com.example.identity.config;

import com.example.identity.properties.ApplicationProperties;
import com.example.identity.security.filter.SessionAuthenticationFilter;
import com.example.identity.web.rest.errors.DelegatedAuthenticationEntryPoint;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

/**
 * Stateless security configuration with three filter chains.
 * <p>
 * PUBLIC (@Order(1)): session exchange, logout, status and health endpoints.
 * CORS on the public and protected chains follows {@code app.security.cors}.
 * PROTECTED (@Order(2)): {@code /api/**}, authenticated by {@link SessionAuthenticationFilter}.
 * DEFAULT (@Order(3)): explicit deny-all.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private final SessionAuthenticationFilter sessionAuthenticationFilter;
  private final DelegatedAuthenticationEntryPoint delegatedAuthenticationEntryPoint;
  private final ApplicationProperties properties;

  @Bean
  @Order(1)
  public SecurityFilterChain publicEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/auth/**",
                         "/actuator/**",
                         "/health/**",
                         "/v3/api-docs/**",
                         "/swagger-ui/**",
                         "/swagger-ui.html")
        .cors(Customizer.withDefaults())
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain protectedEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/api/**")
        .cors(Customizer.withDefaults())
        .addFilterBefore(sessionAuthenticationFilter,
                         UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().authenticated())
        // JSON errors for API clients instead of a login page
        .exceptionHandling(exceptions ->
                               exceptions.authenticationEntryPoint(delegatedAuthenticationEntryPoint));

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(3)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http.authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll());
    applyCommonSettings(http);
    return http.build();
  }

  /**
   * Picked up by name through {@code cors(withDefaults())}. Preflight requests are answered
   * before authorization, so {@code OPTIONS} never needs a session.
   */
  @Bean
  public CorsConfigurationSource corsConfigurationSource() {
    ApplicationProperties.SecurityProperties.CorsProperties cors = properties.security().cors();
    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    if (cors.allowedOrigins().isEmpty()) {
      return source;
    }

    CorsConfiguration configuration = new CorsConfiguration();
    // Patterns, since credentials rule out a literal "*" origin
    configuration.setAllowedOriginPatterns(cors.allowedOrigins());
    configuration.setAllowedMethods(cors.allowedMethods());
    configuration.setAllowedHeaders(cors.allowedHeaders());
    configuration.setAllowCredentials(true);
    configuration.setMaxAge(cors.maxAge());

    source.registerCorsConfiguration("/auth/**", configuration);
    source.registerCorsConfiguration("/api/**", configuration);
    return source;
  }

  /**
   * The filter only runs inside the protected chain, never as a plain servlet filter
   */
  @Bean
  public FilterRegistrationBean<SessionAuthenticationFilter> sessionAuthenticationFilterRegistration(
      SessionAuthenticationFilter filter) {
    FilterRegistrationBean<SessionAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  private void applyCommonSettings(HttpSecurity http) throws Exception {
    boolean embeddable = properties.session().cookie().crossSiteEmbedding();

    http
        .csrf(AbstractHttpConfigurer::disable)
        // Sessions live in the session store or in the token, never in the servlet container
        .sessionManagement(session -> session
            .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .headers(headers -> {
          if (embeddable) {
            // Query parameter transports exist for hosts that frame this service
            headers.frameOptions(FrameOptionsConfig::disable);
          } else {
            headers.frameOptions(FrameOptionsConfig::deny);
          }
          headers
              .contentTypeOptions(contentType -> {
              })
              .referrerPolicy(referrer -> referrer
                  .policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN))
              .permissionsPolicyHeader(permissions -> permissions
                  .policy("camera=(), microphone=(), geolocation=(), payment=()"))
              .httpStrictTransportSecurity(hsts -> hsts
                  .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                  .includeSubDomains(true))
              .addHeaderWriter((request, response) -> {
                // Session responses must never be cached
                response.setHeader("Cache-Control", "no-cache, no-store, must-revalidate");
                response.setHeader("Pragma", "no-cache");
                response.setHeader("Expires", "0");
              });
        });
  }
}
