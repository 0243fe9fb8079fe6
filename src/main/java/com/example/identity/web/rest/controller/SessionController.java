package com.example.identity.web.rest.controller;

import com.example.identity.domain.entity.ResolvedIdentity;
import com.example.identity.exception.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session REST controller; the protected filter chain has already resolved the caller.
 */
@RestController
@Slf4j
public class SessionController implements SessionAPI {

  @Override
  public ResponseEntity<ResolvedIdentity> currentIdentity(ResolvedIdentity identity) {
    if (identity == null) {
      throw new UnauthorizedException("Unauthorized");
    }
    log.trace("Identity lookup for user {}", identity.id());
    return ResponseEntity.ok(identity);
  }
}
