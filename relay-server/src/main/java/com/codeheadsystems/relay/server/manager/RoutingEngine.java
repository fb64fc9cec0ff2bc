package com.codeheadsystems.relay.server.manager;

import com.codeheadsystems.relay.model.EventNames;
import com.codeheadsystems.relay.model.IdentityClaims;
import com.codeheadsystems.relay.model.ReceivedMessage;
import com.codeheadsystems.relay.model.RelayErrorKind;
import com.codeheadsystems.relay.model.RelayFrame;
import com.codeheadsystems.relay.model.SendMessageRequest;
import com.codeheadsystems.relay.server.exceptions.RelayException;
import com.codeheadsystems.relay.server.model.ConversationMessage;
import com.codeheadsystems.relay.server.presence.ConnectionHandle;
import com.codeheadsystems.relay.server.presence.PresenceDirectory;
import com.codeheadsystems.relay.server.store.ConversationStore;
import com.codeheadsystems.relay.server.store.ConversationStoreException;
import java.io.IOException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a direct message from an authenticated sender to an online recipient.
 * <p>
 * Delivery-or-nothing: a message is stored only when the recipient is online, and delivered
 * only after it was stored. There is no store-and-forward.
 * <p>
 * <strong>Exception contract</strong> ({@link RelayException#kind()}):
 * <ul>
 *   <li>{@link RelayErrorKind#UNAUTHENTICATED}: the sender has not authenticated</li>
 *   <li>{@link RelayErrorKind#INVALID_REQUEST}: blank recipient, or missing or oversized content</li>
 *   <li>{@link RelayErrorKind#RECIPIENT_OFFLINE}: nothing was stored</li>
 *   <li>{@link RelayErrorKind#PERSISTENCE_ERROR}: nothing was delivered</li>
 * </ul>
 */
public class RoutingEngine {

  private static final Logger log = LoggerFactory.getLogger(RoutingEngine.class);

  static final String NOT_AUTHENTICATED = "You must authenticate first";
  static final String RECIPIENT_OFFLINE = "Recipient not online";
  static final String STORE_FAILED = "Failed to store message";

  private final PresenceDirectory directory;
  private final ConversationStore store;
  private final int maxContentLength;

  public RoutingEngine(PresenceDirectory directory, ConversationStore store, int maxContentLength) {
    if (maxContentLength < 1) {
      throw new IllegalArgumentException("maxContentLength must be positive");
    }
    this.directory = directory;
    this.store = store;
    this.maxContentLength = maxContentLength;
  }

  /**
   * Stores the message and delivers it to the recipient.
   * <p>
   * Sends from one connection are handled one at a time, in arrival order, so they are stored
   * and delivered in that order.
   *
   * @param sender  the sending connection
   * @param request recipient key and content
   * @return the stored message
   * @throws RelayException see the class contract
   */
  public ConversationMessage sendMessage(ConnectionHandle sender, SendMessageRequest request) {
    ReentrantLock lock = sender.sendLock();
    lock.lock();
    try {
      IdentityClaims from = sender.identity()
          .orElseThrow(() -> new RelayException(RelayErrorKind.UNAUTHENTICATED, NOT_AUTHENTICATED));
      validate(request);

      ConnectionHandle recipient = directory.lookup(request.recipientKey())
          .orElseThrow(() -> new RelayException(RelayErrorKind.RECIPIENT_OFFLINE, RECIPIENT_OFFLINE));
      IdentityClaims to = recipient.identity()
          .filter(claims -> claims.email().equals(request.recipientKey()))
          .orElseThrow(() -> new RelayException(RelayErrorKind.RECIPIENT_OFFLINE, RECIPIENT_OFFLINE));

      ConversationMessage stored;
      try {
        stored = store.recordMessage(from.id(), to.id(), request.content());
      } catch (ConversationStoreException e) {
        log.warn("Failed to store message from {} to {}", from.email(), to.email(), e);
        throw new RelayException(RelayErrorKind.PERSISTENCE_ERROR, STORE_FAILED, e);
      }

      try {
        recipient.emit(RelayFrame.of(EventNames.RECEIVE_MESSAGE,
            new ReceivedMessage(from.email(), request.content())));
      } catch (IOException e) {
        // Stored but not delivered; the recipient's session went away mid-write.
        log.warn("Delivery to {} failed after message {} was stored: {}",
            to.email(), stored.id(), e.getMessage());
      }
      log.info("Routed message {} from {} to {} in conversation {}",
          stored.id(), from.email(), to.email(), stored.conversationId());
      return stored;
    } finally {
      lock.unlock();
    }
  }

  private void validate(SendMessageRequest request) {
    if (request == null) {
      throw new RelayException(RelayErrorKind.INVALID_REQUEST, "Missing message payload");
    }
    if (request.recipientKey() == null || request.recipientKey().isBlank()) {
      throw new RelayException(RelayErrorKind.INVALID_REQUEST, "Recipient is required");
    }
    if (request.content() == null || request.content().isEmpty()) {
      throw new RelayException(RelayErrorKind.INVALID_REQUEST, "Message content is required");
    }
    if (request.content().length() > maxContentLength) {
      throw new RelayException(RelayErrorKind.INVALID_REQUEST,
          "Message content exceeds " + maxContentLength + " characters");
    }
  }
}
