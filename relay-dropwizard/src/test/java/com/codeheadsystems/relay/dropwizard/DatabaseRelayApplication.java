package com.codeheadsystems.relay.dropwizard;

import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Test application whose conversation store is built from the {@code database} block.
 */
public class DatabaseRelayApplication extends Application<RelayConfiguration> {

  @Override
  public String getName() {
    return "relay-db-test";
  }

  @Override
  public void initialize(Bootstrap<RelayConfiguration> bootstrap) {
    bootstrap.addBundle(new RelayBundle<>());
  }

  @Override
  public void run(RelayConfiguration configuration, Environment environment) {
    // Everything is registered by the bundle
  }
}
