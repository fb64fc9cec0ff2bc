package com.codeheadsystems.relay.server.auth;

/**
 * Thrown by an {@link IdentityVerifier} when a credential is rejected.
 */
public class AuthenticationFailedException extends Exception {

  /**
   * Instantiates a new Authentication failed exception.
   *
   * @param message the reason
   */
  public AuthenticationFailedException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Authentication failed exception.
   *
   * @param message the reason
   * @param cause   the cause
   */
  public AuthenticationFailedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
