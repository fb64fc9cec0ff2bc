package com.codeheadsystems.relay.server.manager;

import com.codeheadsystems.relay.model.IdentityClaims;
import com.codeheadsystems.relay.model.RelayErrorKind;
import com.codeheadsystems.relay.server.auth.AuthenticationFailedException;
import com.codeheadsystems.relay.server.auth.IdentityVerifier;
import com.codeheadsystems.relay.server.exceptions.RelayException;
import com.codeheadsystems.relay.server.presence.ConnectionHandle;
import com.codeheadsystems.relay.server.presence.EventSink;
import com.codeheadsystems.relay.server.presence.PresenceDirectory;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic owner of the connect / authenticate / disconnect lifecycle.
 * <p>
 * Transport adapters call into this class and stay thin; they only translate the exception
 * contract into frames on the wire.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link RelayException} with {@link RelayErrorKind#AUTH_FAILURE}: the credential was
 *   rejected, or the session was refused by {@link DuplicateSessionPolicy#REJECT}. No state
 *   was changed.</li>
 * </ul>
 */
public class ConnectionLifecycleManager {

  private static final Logger log = LoggerFactory.getLogger(ConnectionLifecycleManager.class);

  static final String INVALID_TOKEN = "Invalid or expired token";
  static final String ALREADY_CONNECTED = "Identity already connected";
  static final String CONNECTION_CLOSED = "Connection closed";
  static final String EVICTED = "Signed in from another connection";

  private final IdentityVerifier verifier;
  private final PresenceDirectory directory;
  private final DuplicateSessionPolicy policy;

  public ConnectionLifecycleManager(IdentityVerifier verifier,
                                    PresenceDirectory directory,
                                    DuplicateSessionPolicy policy) {
    this.verifier = verifier;
    this.directory = directory;
    this.policy = policy;
    log.info("ConnectionLifecycleManager(policy={})", policy);
  }

  // ── Connect ──────────────────────────────────────────────────────────────

  /**
   * Creates the handle for a freshly opened transport session. Nothing is registered in the
   * presence directory until the connection authenticates.
   *
   * @param sink outbound side of the session
   * @return the handle in {@code CONNECTED}
   */
  public ConnectionHandle onConnect(EventSink sink) {
    ConnectionHandle handle = new ConnectionHandle(sink);
    log.info("Connected: {}", handle.connectionId());
    return handle;
  }

  // ── Authenticate ─────────────────────────────────────────────────────────

  /**
   * Verifies the credential and binds the identity to the handle.
   *
   * @param handle     the connection
   * @param credential the token presented by the client
   * @return the verified public claims
   * @throws RelayException with {@link RelayErrorKind#AUTH_FAILURE} on rejection
   */
  public IdentityClaims onAuthenticate(ConnectionHandle handle, String credential) {
    IdentityClaims claims;
    try {
      claims = verifier.verify(credential);
    } catch (AuthenticationFailedException e) {
      log.debug("Authentication failed on {}: {}", handle.connectionId(), e.getMessage());
      throw new RelayException(RelayErrorKind.AUTH_FAILURE, INVALID_TOKEN, e);
    }
    String key = claims.email();
    if (handle.isClosed()) {
      throw new RelayException(RelayErrorKind.AUTH_FAILURE, CONNECTION_CLOSED);
    }
    Optional<IdentityClaims> previous = handle.identity();

    // Directory first; the handle keeps its previous identity until the bind is accepted.
    switch (policy) {
      case REJECT -> bindOrReject(key, handle);
      case EVICT -> directory.bind(key, handle)
          .filter(displaced -> displaced != handle)
          .ifPresent(displaced -> {
            log.info("Evicting {} for {}", displaced.connectionId(), key);
            displaced.evict(EVICTED);
          });
      default -> directory.bind(key, handle)
          .filter(displaced -> displaced != handle)
          .ifPresent(displaced ->
              log.info("Replaced {} with {} for {}", displaced.connectionId(),
                  handle.connectionId(), key));
    }

    if (!handle.authenticate(claims)) {
      // Closed while binding; onDisconnect saw only the previous identity.
      directory.unbind(key, handle);
      throw new RelayException(RelayErrorKind.AUTH_FAILURE, CONNECTION_CLOSED);
    }

    previous.map(IdentityClaims::email)
        .filter(oldKey -> !oldKey.equals(key))
        .ifPresent(oldKey -> directory.unbind(oldKey, handle));

    if (handle.isClosed()) {
      directory.unbind(key, handle);
      throw new RelayException(RelayErrorKind.AUTH_FAILURE, CONNECTION_CLOSED);
    }
    log.info("Authenticated {} as {}", handle.connectionId(), key);
    return claims;
  }

  private void bindOrReject(String key, ConnectionHandle handle) {
    Optional<ConnectionHandle> existing = directory.bindIfAbsent(key, handle);
    if (existing.isEmpty() || existing.get() == handle) {
      return;
    }
    ConnectionHandle current = existing.get();
    if (current.isClosed() && directory.replace(key, current, handle)) {
      log.debug("Replaced closed connection {} for {}", current.connectionId(), key);
      return;
    }
    log.info("Rejected duplicate session {} for {}", handle.connectionId(), key);
    throw new RelayException(RelayErrorKind.AUTH_FAILURE, ALREADY_CONNECTED);
  }

  // ── Disconnect ───────────────────────────────────────────────────────────

  /**
   * Closes the handle and removes its presence entry, but only when the entry still points at
   * this handle. Safe to call more than once.
   *
   * @param handle the connection
   */
  public void onDisconnect(ConnectionHandle handle) {
    Optional<IdentityClaims> identity = handle.close();
    if (identity.isEmpty()) {
      log.debug("Disconnected: {} (not present)", handle.connectionId());
      return;
    }
    String key = identity.get().email();
    if (directory.unbind(key, handle)) {
      log.info("Disconnected: {} ({})", handle.connectionId(), key);
    } else {
      log.debug("Disconnected: {} ({}), entry already owned by a newer connection",
          handle.connectionId(), key);
    }
  }

  /**
   * Number of identities currently online.
   *
   * @return the count
   */
  public int onlineCount() {
    return directory.size();
  }
}
