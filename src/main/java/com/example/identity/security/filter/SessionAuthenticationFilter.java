package com.example.identity.security.filter;

import com.example.identity.domain.entity.ResolvedIdentity;
import com.example.identity.properties.ApplicationProperties;
import com.example.identity.service.SessionService;
import com.example.identity.util.CookieUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Authenticates requests from whichever session transport they carry.
 * Delegates all resolution logic to the {@link SessionService}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionAuthenticationFilter extends OncePerRequestFilter {

  public static final String ROLE_ELEVATED = "ROLE_ELEVATED";
  public static final String TAG_AUTHORITY_PREFIX = "TAG_";

  private final SessionService sessionService;
  private final ApplicationProperties properties;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain) throws ServletException, IOException {

    try {
      Optional<ResolvedIdentity> identity = sessionService.resolve(request);
      if (identity.isPresent()) {
        SecurityContextHolder.getContext().setAuthentication(toAuthentication(identity.get()));
        log.trace("Authenticated request for user {}", identity.get().id());
      } else {
        // The entry point answers 401 if the endpoint needs a session
        log.trace("No resolvable session on request");
      }
    } catch (Exception e) {
      log.error("An unexpected error occurred during session authentication.", e);
      ApplicationProperties.SessionProperties session = properties.session();
      CookieUtil.CookieAttributes attributes = new CookieUtil.CookieAttributes(
          session.cookie().secure(), session.cookie().crossSiteEmbedding());
      CookieUtil.clearSessionCookie(response, session.transport().tokenCookie(), attributes);
      CookieUtil.clearSessionCookie(response, session.transport().sessionIdCookie(), attributes);
    }

    filterChain.doFilter(request, response);
  }

  static UsernamePasswordAuthenticationToken toAuthentication(ResolvedIdentity identity) {
    List<GrantedAuthority> authorities = new ArrayList<>();
    identity.tags().forEach(tag -> authorities.add(new SimpleGrantedAuthority(TAG_AUTHORITY_PREFIX + tag)));
    if (identity.elevated()) {
      authorities.add(new SimpleGrantedAuthority(ROLE_ELEVATED));
    }
    return new UsernamePasswordAuthenticationToken(identity, null, authorities);
  }
}
