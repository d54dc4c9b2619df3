package com.codeheadsystems.relay.testserver;

import com.codeheadsystems.relay.dropwizard.RelayBundle;
import com.codeheadsystems.relay.dropwizard.RelayConfiguration;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable Dropwizard application for local developer testing of relay clients.
 * Logins are checked against the {@code users} map in {@code config/config.yml} and all
 * tokens and connections live in memory.
 * <p>
 * Start with {@code java -jar relay-testserver.jar server config/config.yml}.
 */
public class RelayTestServerApplication extends Application<RelayConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new RelayTestServerApplication().run(args);
  }

  @Override
  public String getName() {
    return "relay-testserver";
  }

  @Override
  public void initialize(Bootstrap<RelayConfiguration> bootstrap) {
    // Allow ${ENV_VAR:-default} substitution in config YAML files so environment
    // variables can override individual keys without replacing the entire file.
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(false)
        )
    );
    bootstrap.addBundle(new RelayBundle<>());
  }

  @Override
  public void run(RelayConfiguration configuration, Environment environment) {
    // Everything is registered by RelayBundle
  }
}
