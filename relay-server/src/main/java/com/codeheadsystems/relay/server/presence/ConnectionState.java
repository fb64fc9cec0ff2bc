package com.codeheadsystems.relay.server.presence;

/**
 * Lifecycle states of a {@link ConnectionHandle}.
 */
public enum ConnectionState {
  CONNECTED,
  AUTHENTICATED,
  CLOSED
}
