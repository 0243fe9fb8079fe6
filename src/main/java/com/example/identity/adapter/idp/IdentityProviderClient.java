package com.example.identity.adapter.idp;

import com.example.identity.domain.entity.ExternalClaims;

/**
 * Interface for Identity Provider clients.
 * Performs the credential exchange only; session creation is the caller's concern.
 */
public interface IdentityProviderClient {

  /**
   * Exchanges an access token for the claims the provider asserts about its holder.
   *
   * @throws com.example.identity.exception.OAuth2Exception when the token is rejected or the
   *     provider cannot be reached
   */
  ExternalClaims exchange(String accessToken);
}
