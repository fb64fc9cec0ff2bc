package com.codeheadsystems.relay.dropwizard.websocket;

import com.codeheadsystems.relay.model.RelayFrame;
import com.codeheadsystems.relay.server.presence.EventSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.websocket.CloseReason;
import jakarta.websocket.Session;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventSink} writing JSON text frames to a Jakarta WebSocket session.
 * <p>
 * The basic remote endpoint does not allow concurrent writes, so sends are serialized on this
 * sink.
 */
public class WebSocketEventSink implements EventSink {

  private static final Logger log = LoggerFactory.getLogger(WebSocketEventSink.class);

  // RFC 6455 limits the close reason to 123 bytes of UTF-8.
  private static final int MAX_REASON_BYTES = 123;

  private final Session session;
  private final ObjectMapper objectMapper;

  public WebSocketEventSink(Session session, ObjectMapper objectMapper) {
    this.session = session;
    this.objectMapper = objectMapper;
  }

  @Override
  public void send(RelayFrame frame) throws IOException {
    String json = objectMapper.writeValueAsString(frame);
    synchronized (this) {
      if (!session.isOpen()) {
        throw new IOException("WebSocket session " + session.getId() + " is closed");
      }
      session.getBasicRemote().sendText(json);
    }
  }

  @Override
  public void close(String reason) {
    if (!session.isOpen()) {
      return;
    }
    try {
      session.close(new CloseReason(CloseReason.CloseCodes.NORMAL_CLOSURE, truncate(reason)));
    } catch (IOException e) {
      log.debug("Closing WebSocket session {} failed: {}", session.getId(), e.getMessage());
    }
  }

  static String truncate(String reason) {
    if (reason == null) {
      return "";
    }
    byte[] bytes = reason.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= MAX_REASON_BYTES) {
      return reason;
    }
    int end = Math.min(reason.length(), MAX_REASON_BYTES);
    while (reason.substring(0, end).getBytes(StandardCharsets.UTF_8).length > MAX_REASON_BYTES) {
      end--;
    }
    return reason.substring(0, end);
  }
}
