package com.codeheadsystems.relay.dropwizard.websocket;

import com.codeheadsystems.relay.server.protocol.RelayDispatcher;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.websocket.server.ServerEndpointConfig;

/**
 * Hands the container a fresh {@link RelayEndpoint} wired to the shared dispatcher for every
 * connection.
 */
public class RelayEndpointConfigurator extends ServerEndpointConfig.Configurator {

  private final RelayDispatcher dispatcher;
  private final ObjectMapper objectMapper;
  private final long idleTimeoutMillis;

  public RelayEndpointConfigurator(RelayDispatcher dispatcher,
                                   ObjectMapper objectMapper,
                                   long idleTimeoutMillis) {
    this.dispatcher = dispatcher;
    this.objectMapper = objectMapper;
    this.idleTimeoutMillis = idleTimeoutMillis;
  }

  @Override
  public <T> T getEndpointInstance(Class<T> endpointClass) throws InstantiationException {
    if (!endpointClass.isAssignableFrom(RelayEndpoint.class)) {
      throw new InstantiationException("Unsupported endpoint " + endpointClass.getName());
    }
    return endpointClass.cast(new RelayEndpoint(dispatcher, objectMapper, idleTimeoutMillis));
  }
}
