package com.codeheadsystems.relay.server.auth;

import com.codeheadsystems.relay.model.IdentityClaims;

/**
 * Turns a client credential into the identity it proves.
 * <p>
 * Implementations must be thread-safe, idempotent and free of side effects visible to the
 * relay. The relay calls {@link #verify} exactly once per authentication attempt and never
 * retries; a rejected client must submit a new attempt.
 */
public interface IdentityVerifier {

  /**
   * Verifies a credential.
   *
   * @param credential the credential presented by the client, may be null
   * @return the verified identity claims
   * @throws AuthenticationFailedException if the credential is missing, malformed, expired or
   *                                       does not carry the claims the relay needs
   */
  IdentityClaims verify(String credential) throws AuthenticationFailedException;
}
