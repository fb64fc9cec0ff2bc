package com.codeheadsystems.relay.model;

/**
 * Failure kinds reported to clients on rejection frames.
 */
public enum RelayErrorKind {

  /**
   * The credential was missing, malformed, expired, or the session was refused.
   */
  AUTH_FAILURE,

  /**
   * An action that requires authentication was attempted before authenticating.
   */
  UNAUTHENTICATED,

  /**
   * The recipient has no live connection. Nothing was stored.
   */
  RECIPIENT_OFFLINE,

  /**
   * The message could not be stored. Nothing was delivered; the client may retry.
   */
  PERSISTENCE_ERROR,

  /**
   * The frame could not be decoded or its payload was invalid.
   */
  INVALID_REQUEST
}
