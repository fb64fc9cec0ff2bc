package com.codeheadsystems.relay.server.exceptions;

import com.codeheadsystems.relay.model.RelayErrorKind;

/**
 * A user-facing failure of a relay operation.
 * <p>
 * Thrown by the managers and translated into a rejection frame on the originating connection
 * by the dispatcher. The message is the reason shown to the client.
 */
public class RelayException extends RuntimeException {

  private final RelayErrorKind kind;

  /**
   * Instantiates a new Relay exception.
   *
   * @param kind    the failure kind
   * @param message the reason shown to the client
   */
  public RelayException(final RelayErrorKind kind, final String message) {
    super(message);
    this.kind = kind;
  }

  /**
   * Instantiates a new Relay exception.
   *
   * @param kind    the failure kind
   * @param message the reason shown to the client
   * @param cause   the cause
   */
  public RelayException(final RelayErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /**
   * The failure kind.
   *
   * @return the kind
   */
  public RelayErrorKind kind() {
    return kind;
  }
}
