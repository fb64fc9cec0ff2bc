package com.codeheadsystems.relay.server.presence;

import com.codeheadsystems.relay.model.IdentityClaims;
import com.codeheadsystems.relay.model.RelayFrame;
import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One live transport session and the identity bound to it.
 * <p>
 * State moves {@code CONNECTED → AUTHENTICATED → CLOSED}; {@code CLOSED} is terminal. State and
 * identity are guarded by this handle's monitor. Handles compare by identity, so the presence
 * directory can tell a newer session of the same user from this one.
 */
public class ConnectionHandle {

  private final String connectionId;
  private final EventSink sink;
  private final ReentrantLock sendLock = new ReentrantLock();

  private ConnectionState state = ConnectionState.CONNECTED;
  private IdentityClaims identity;

  /**
   * Creates a handle in {@link ConnectionState#CONNECTED}.
   *
   * @param sink outbound side of the transport session
   */
  public ConnectionHandle(EventSink sink) {
    this(UUID.randomUUID().toString(), sink);
  }

  /**
   * Creates a handle in {@link ConnectionState#CONNECTED}.
   *
   * @param connectionId opaque connection identifier
   * @param sink         outbound side of the transport session
   */
  public ConnectionHandle(String connectionId, EventSink sink) {
    this.connectionId = connectionId;
    this.sink = sink;
  }

  public String connectionId() {
    return connectionId;
  }

  public synchronized ConnectionState state() {
    return state;
  }

  /**
   * The bound identity, present only while {@link ConnectionState#AUTHENTICATED}.
   *
   * @return the identity
   */
  public synchronized Optional<IdentityClaims> identity() {
    return state == ConnectionState.AUTHENTICATED ? Optional.of(identity) : Optional.empty();
  }

  /**
   * Binds an identity and moves to {@link ConnectionState#AUTHENTICATED}. A handle that is
   * already authenticated is rebound.
   *
   * @param claims the verified identity
   * @return false if the handle is already closed, in which case nothing changes
   */
  public synchronized boolean authenticate(IdentityClaims claims) {
    if (state == ConnectionState.CLOSED) {
      return false;
    }
    identity = claims;
    state = ConnectionState.AUTHENTICATED;
    return true;
  }

  /**
   * Moves to {@link ConnectionState#CLOSED}.
   *
   * @return the identity that was bound, only on the transition out of
   *     {@link ConnectionState#AUTHENTICATED}; empty when not authenticated or already closed
   */
  public synchronized Optional<IdentityClaims> close() {
    ConnectionState previous = state;
    state = ConnectionState.CLOSED;
    return previous == ConnectionState.AUTHENTICATED ? Optional.of(identity) : Optional.empty();
  }

  public synchronized boolean isClosed() {
    return state == ConnectionState.CLOSED;
  }

  /**
   * Writes a frame to this connection.
   *
   * @param frame the frame
   * @throws IOException if the transport write fails
   */
  public void emit(RelayFrame frame) throws IOException {
    sink.send(frame);
  }

  /**
   * Closes the transport session from the relay side. The transport reports the close back
   * through the normal disconnect path.
   *
   * @param reason reason reported to the client
   */
  public void evict(String reason) {
    sink.close(reason);
  }

  /**
   * Lock held while a send from this connection is routed, so that sends from one connection
   * are stored and delivered in the order they arrived.
   *
   * @return the lock
   */
  public ReentrantLock sendLock() {
    return sendLock;
  }

  @Override
  public String toString() {
    return "ConnectionHandle{" + connectionId + "}";
  }
}
