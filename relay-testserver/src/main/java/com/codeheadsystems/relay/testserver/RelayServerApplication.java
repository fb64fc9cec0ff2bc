package com.codeheadsystems.relay.testserver;

import com.codeheadsystems.relay.dropwizard.RelayBundle;
import com.codeheadsystems.relay.dropwizard.RelayConfiguration;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable relay server.
 * <p>
 * Reads {@code config/config.yml}, where {@code JWT_SECRET}, {@code DATABASE_URL} and
 * {@code PORT} (default 3000) are substituted from the environment:
 * <pre>
 *   JWT_SECRET=... DATABASE_URL=jdbc:postgresql://localhost/relay \
 *     java -jar relay-testserver.jar server config/config.yml
 * </pre>
 */
public class RelayServerApplication extends Application<RelayConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new RelayServerApplication().run(args);
  }

  @Override
  public String getName() {
    return "relay-server";
  }

  @Override
  public void initialize(Bootstrap<RelayConfiguration> bootstrap) {
    // Strict substitution: a missing JWT_SECRET or DATABASE_URL stops startup instead of
    // running with an empty value.
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(true)
        )
    );
    bootstrap.addBundle(new RelayBundle<>());
  }

  @Override
  public void run(RelayConfiguration configuration, Environment environment) {
    // Everything is registered by the bundle
  }
}
