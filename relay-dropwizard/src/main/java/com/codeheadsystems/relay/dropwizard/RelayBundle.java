package com.codeheadsystems.relay.dropwizard;

import com.codahale.metrics.Gauge;
import com.codeheadsystems.relay.dropwizard.health.ConversationStoreHealthCheck;
import com.codeheadsystems.relay.dropwizard.managed.KeepAlivePinger;
import com.codeheadsystems.relay.dropwizard.resource.LivenessResource;
import com.codeheadsystems.relay.dropwizard.websocket.RelayEndpoint;
import com.codeheadsystems.relay.dropwizard.websocket.RelayEndpointConfigurator;
import com.codeheadsystems.relay.server.auth.JwtIdentityVerifier;
import com.codeheadsystems.relay.server.manager.ConnectionLifecycleManager;
import com.codeheadsystems.relay.server.manager.RoutingEngine;
import com.codeheadsystems.relay.server.presence.InMemoryPresenceDirectory;
import com.codeheadsystems.relay.server.presence.PresenceDirectory;
import com.codeheadsystems.relay.server.protocol.RelayDispatcher;
import com.codeheadsystems.relay.server.store.ConversationStore;
import com.codeheadsystems.relay.server.store.InMemoryConversationStore;
import com.codeheadsystems.relay.server.store.MyBatisConversationStore;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.db.DataSourceFactory;
import io.dropwizard.db.ManagedDataSource;
import jakarta.websocket.server.ServerEndpointConfig;
import java.nio.charset.StandardCharsets;
import org.eclipse.jetty.websocket.jakarta.server.config.JakartaWebSocketServletContainerInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the messaging relay into an existing Dropwizard application.
 * <p>
 * Registers the WebSocket endpoint, the liveness resource, the conversation store health check,
 * the online-users gauge and, when configured, the keep-alive pinger. Requires a
 * {@link RelayConfiguration} in the application's YAML config.
 * <p>
 * With no arguments the conversation store comes from the {@code database} block, or is kept in
 * memory when that block is absent (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new RelayBundle<>());
 * }</pre>
 * <p>
 * Or supply a store:
 * <pre>{@code
 *   bootstrap.addBundle(new RelayBundle<>(myConversationStore));
 * }</pre>
 */
public class RelayBundle<C extends RelayConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(RelayBundle.class);

  static final String ONLINE_GAUGE = "relay.presence.online";

  private final ConversationStore suppliedStore;

  private ConnectionLifecycleManager lifecycleManager;

  /**
   * Creates a bundle whose conversation store is built from the configuration.
   */
  public RelayBundle() {
    this(null);
  }

  /**
   * Creates a bundle backed by the supplied conversation store; the {@code database} block is
   * ignored.
   *
   * @param conversationStore the store
   */
  public RelayBundle(ConversationStore conversationStore) {
    this.suppliedStore = conversationStore;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    ConversationStore store = suppliedStore != null
        ? suppliedStore
        : buildStore(configuration, environment);

    JwtIdentityVerifier verifier = new JwtIdentityVerifier(
        configuration.getJwtSecret().getBytes(StandardCharsets.UTF_8),
        configuration.getJwtIssuer(),
        configuration.getJwtTtlSeconds());
    PresenceDirectory directory = new InMemoryPresenceDirectory();
    lifecycleManager = new ConnectionLifecycleManager(
        verifier, directory, configuration.getDuplicateSessionPolicy());
    RoutingEngine routingEngine = new RoutingEngine(
        directory, store, configuration.getMaxContentLength());
    RelayDispatcher dispatcher = new RelayDispatcher(
        environment.getObjectMapper(), lifecycleManager, routingEngine);

    registerWebSocket(configuration, environment, dispatcher);
    environment.jersey().register(new LivenessResource(configuration.getLivenessMessage()));
    environment.healthChecks().register("conversation-store", new ConversationStoreHealthCheck(store));
    environment.metrics().register(ONLINE_GAUGE, (Gauge<Integer>) lifecycleManager::onlineCount);

    String keepAliveUrl = configuration.getKeepAliveUrl();
    if (keepAliveUrl != null && !keepAliveUrl.isBlank()) {
      environment.lifecycle().manage(new KeepAlivePinger(keepAliveUrl,
          configuration.getKeepAliveInterval().toJavaDuration()));
    }
  }

  private ConversationStore buildStore(C configuration, Environment environment) {
    DataSourceFactory factory = configuration.getDataSourceFactory();
    if (factory == null) {
      log.warn("""
          #################################################################
          # WARNING: No database configured. Conversations are kept in   #
          # memory and will be lost on restart.                           #
          # Do not use in production.                                     #
          #################################################################
          """);
      return new InMemoryConversationStore();
    }
    ManagedDataSource dataSource = factory.build(environment.metrics(), "relay-db");
    environment.lifecycle().manage(dataSource);
    MyBatisConversationStore store = new MyBatisConversationStore(dataSource);
    store.createSchema();
    return store;
  }

  private void registerWebSocket(C configuration, Environment environment, RelayDispatcher dispatcher) {
    long idleTimeoutMillis = configuration.getWebsocketIdleTimeout().toMilliseconds();
    ServerEndpointConfig endpointConfig = ServerEndpointConfig.Builder
        .create(RelayEndpoint.class, configuration.getWebsocketPath())
        .configurator(new RelayEndpointConfigurator(
            dispatcher, environment.getObjectMapper(), idleTimeoutMillis))
        .build();
    JakartaWebSocketServletContainerInitializer.configure(environment.getApplicationContext(),
        (servletContext, container) -> {
          container.setDefaultMaxSessionIdleTimeout(idleTimeoutMillis);
          container.addEndpoint(endpointConfig);
        });
    log.info("Relay WebSocket endpoint registered at {}", configuration.getWebsocketPath());
  }
}
