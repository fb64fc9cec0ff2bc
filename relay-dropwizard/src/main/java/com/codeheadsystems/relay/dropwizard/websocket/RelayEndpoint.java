package com.codeheadsystems.relay.dropwizard.websocket;

import com.codeheadsystems.relay.server.presence.ConnectionHandle;
import com.codeheadsystems.relay.server.protocol.RelayDispatcher;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.websocket.CloseReason;
import jakarta.websocket.Endpoint;
import jakarta.websocket.EndpointConfig;
import jakarta.websocket.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WebSocket endpoint for one client session. A new instance is created per connection by
 * {@link RelayEndpointConfigurator}.
 * <p>
 * The endpoint only adapts container callbacks; all relay behavior lives in
 * {@link RelayDispatcher}.
 */
public class RelayEndpoint extends Endpoint {

  private static final Logger log = LoggerFactory.getLogger(RelayEndpoint.class);

  private final RelayDispatcher dispatcher;
  private final ObjectMapper objectMapper;
  private final long idleTimeoutMillis;

  private volatile ConnectionHandle handle;

  public RelayEndpoint(RelayDispatcher dispatcher, ObjectMapper objectMapper, long idleTimeoutMillis) {
    this.dispatcher = dispatcher;
    this.objectMapper = objectMapper;
    this.idleTimeoutMillis = idleTimeoutMillis;
  }

  @Override
  public void onOpen(Session session, EndpointConfig config) {
    session.setMaxIdleTimeout(idleTimeoutMillis);
    ConnectionHandle opened = dispatcher.open(new WebSocketEventSink(session, objectMapper));
    handle = opened;
    session.addMessageHandler(String.class, text -> dispatcher.dispatch(opened, text));
  }

  @Override
  public void onClose(Session session, CloseReason closeReason) {
    ConnectionHandle opened = handle;
    if (opened != null) {
      log.debug("WebSocket {} closed: {}", opened.connectionId(), closeReason);
      dispatcher.close(opened);
    }
  }

  @Override
  public void onError(Session session, Throwable thr) {
    ConnectionHandle opened = handle;
    log.warn("WebSocket error on {}: {}",
        opened == null ? session.getId() : opened.connectionId(), thr.toString());
  }
}
