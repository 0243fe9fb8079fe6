package com.example.identity.service;

import com.example.identity.adapter.idp.IdentityProviderClient;
import com.example.identity.domain.entity.ExternalClaims;
import com.example.identity.domain.entity.IssuedSession;
import com.example.identity.exception.OAuth2Exception;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

/**
 * Exchanges an identity provider access token for a local session.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionExchangeService {

  private final IdentityProviderClient identityProviderClient;
  private final SessionLifecycleService lifecycleService;

  /**
   * @throws OAuth2Exception when the provider rejects the token or cannot be reached
   */
  public IssuedSession exchange(@NonNull String accessToken) {
    ExternalClaims claims = identityProviderClient.exchange(accessToken);
    List<String> tags = TagsNormalizer.normalize(claims.tags());

    log.debug("Access token accepted for subject {} with {} tag(s)", claims.subject(), tags.size());
    return lifecycleService.create(claims.subject(), claims.email(), claims.displayName(), tags);
  }
}
