package com.codeheadsystems.relay.model;

/**
 * Event names carried in the {@code event} field of every {@link RelayFrame}.
 * <p>
 * These names are part of the wire contract with existing clients and must not change.
 */
public final class EventNames {

  // ── Inbound (client → relay) ──────────────────────────────────────────────

  /**
   * Client presents a signed token; data is the token string.
   */
  public static final String AUTHENTICATE = "authenticate";

  /**
   * Client sends a direct message; data is a {@link SendMessageRequest}.
   */
  public static final String SEND_MESSAGE = "send_message";

  /**
   * Older spelling of {@link #SEND_MESSAGE}, handled identically.
   */
  public static final String REGISTER = "register";

  /**
   * Client asks the relay to close its connection.
   */
  public static final String DISCONNECT = "disconnect";

  // ── Outbound (relay → client) ─────────────────────────────────────────────

  /**
   * Authentication accepted; data is the caller's {@link IdentityClaims}.
   */
  public static final String AUTH_SUCCESS = "auth_success";

  /**
   * Authentication rejected; data is a reason string.
   */
  public static final String AUTH_ERROR = "auth_error";

  /**
   * A message delivered to its recipient; data is a {@link ReceivedMessage}.
   */
  public static final String RECEIVE_MESSAGE = "receive_message";

  /**
   * A request failed; data is a reason string and {@code kind} names the {@link RelayErrorKind}.
   */
  public static final String ERROR = "error";

  private EventNames() {
  }
}
