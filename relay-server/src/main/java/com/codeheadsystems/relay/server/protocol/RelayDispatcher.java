package com.codeheadsystems.relay.server.protocol;

import com.codeheadsystems.relay.model.EventNames;
import com.codeheadsystems.relay.model.IdentityClaims;
import com.codeheadsystems.relay.model.RelayErrorKind;
import com.codeheadsystems.relay.model.RelayFrame;
import com.codeheadsystems.relay.model.SendMessageRequest;
import com.codeheadsystems.relay.server.exceptions.RelayException;
import com.codeheadsystems.relay.server.manager.ConnectionLifecycleManager;
import com.codeheadsystems.relay.server.manager.RoutingEngine;
import com.codeheadsystems.relay.server.presence.ConnectionHandle;
import com.codeheadsystems.relay.server.presence.EventSink;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes inbound text frames and hands them to the lifecycle manager or the routing engine.
 * <p>
 * Every {@link RelayException} raised while handling a frame becomes a rejection frame on the
 * same connection: {@code auth_error} for authentication failures, {@code error} otherwise.
 */
public class RelayDispatcher {

  private static final Logger log = LoggerFactory.getLogger(RelayDispatcher.class);

  static final String MALFORMED_FRAME = "Malformed frame";
  static final String MISSING_PAYLOAD = "Missing message payload";

  private final ObjectMapper objectMapper;
  private final ConnectionLifecycleManager lifecycleManager;
  private final RoutingEngine routingEngine;

  public RelayDispatcher(ObjectMapper objectMapper,
                         ConnectionLifecycleManager lifecycleManager,
                         RoutingEngine routingEngine) {
    this.objectMapper = objectMapper;
    this.lifecycleManager = lifecycleManager;
    this.routingEngine = routingEngine;
  }

  public ConnectionHandle open(EventSink sink) {
    return lifecycleManager.onConnect(sink);
  }

  public void close(ConnectionHandle handle) {
    lifecycleManager.onDisconnect(handle);
  }

  /**
   * Handles one inbound text frame.
   *
   * @param handle the originating connection
   * @param text   the raw JSON frame
   */
  public void dispatch(ConnectionHandle handle, String text) {
    try {
      JsonNode frame = parse(text);
      String event = frame.get("event").asText();
      JsonNode data = frame.get("data");
      switch (event) {
        case EventNames.AUTHENTICATE -> {
          IdentityClaims claims = lifecycleManager.onAuthenticate(handle, token(data));
          emit(handle, RelayFrame.of(EventNames.AUTH_SUCCESS, claims));
        }
        case EventNames.SEND_MESSAGE, EventNames.REGISTER ->
            routingEngine.sendMessage(handle, sendRequest(data));
        case EventNames.DISCONNECT -> {
          lifecycleManager.onDisconnect(handle);
          handle.evict("Client requested disconnect");
        }
        default -> throw new RelayException(RelayErrorKind.INVALID_REQUEST, "Unknown event: " + event);
      }
    } catch (RelayException e) {
      log.debug("{} rejected on {}: {}", e.kind(), handle.connectionId(), e.getMessage());
      emit(handle, RelayFrame.error(e.kind(), e.getMessage()));
    }
  }

  private JsonNode parse(String text) {
    JsonNode frame;
    try {
      frame = objectMapper.readTree(text);
    } catch (JsonProcessingException e) {
      throw new RelayException(RelayErrorKind.INVALID_REQUEST, MALFORMED_FRAME, e);
    }
    if (frame == null || !frame.isObject() || frame.get("event") == null
        || !frame.get("event").isTextual()) {
      throw new RelayException(RelayErrorKind.INVALID_REQUEST, MALFORMED_FRAME);
    }
    return frame;
  }

  /**
   * Accepts the token either as the bare data string or as {@code {"token": "..."}}. Anything
   * else yields null, which the verifier rejects.
   */
  private String token(JsonNode data) {
    if (data == null) {
      return null;
    }
    if (data.isTextual()) {
      return data.asText();
    }
    JsonNode token = data.get("token");
    return token != null && token.isTextual() ? token.asText() : null;
  }

  private SendMessageRequest sendRequest(JsonNode data) {
    if (data == null || !data.isObject()) {
      throw new RelayException(RelayErrorKind.INVALID_REQUEST, MISSING_PAYLOAD);
    }
    try {
      return objectMapper.treeToValue(data, SendMessageRequest.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new RelayException(RelayErrorKind.INVALID_REQUEST, MALFORMED_FRAME, e);
    }
  }

  private void emit(ConnectionHandle handle, RelayFrame frame) {
    try {
      handle.emit(frame);
    } catch (IOException e) {
      log.debug("Could not write {} to {}: {}", frame.event(), handle.connectionId(), e.getMessage());
    }
  }
}
