package com.codeheadsystems.relay.dropwizard;

import com.codahale.metrics.Gauge;
import com.codeheadsystems.relay.dropwizard.health.ConnectionRegistryHealthCheck;
import com.codeheadsystems.relay.dropwizard.health.TokenStoreHealthCheck;
import com.codeheadsystems.relay.dropwizard.websocket.AdmissionServlet;
import com.codeheadsystems.relay.model.EventTypes;
import com.codeheadsystems.relay.server.auth.CredentialVerifier;
import com.codeheadsystems.relay.server.auth.InMemoryCredentialVerifier;
import com.codeheadsystems.relay.server.connection.ConnectionSettings;
import com.codeheadsystems.relay.server.event.EventRouter;
import com.codeheadsystems.relay.server.event.SendMessageHandler;
import com.codeheadsystems.relay.server.manager.LoginManager;
import com.codeheadsystems.relay.server.registry.ConnectionRegistry;
import com.codeheadsystems.relay.server.registry.OriginPolicy;
import com.codeheadsystems.relay.server.resource.DebugResource;
import com.codeheadsystems.relay.server.resource.LoginResource;
import com.codeheadsystems.relay.server.store.InMemoryTokenStore;
import com.codeheadsystems.relay.server.store.TokenStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import java.time.Clock;
import java.time.Duration;
import org.eclipse.jetty.websocket.server.config.JettyWebSocketServletContainerInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the relay into an existing Dropwizard application.
 * <p>
 * Registers {@code POST /login}, {@code GET /debug}, the WebSocket admission servlet at
 * {@code websocketPath}, the {@code token-store} and {@code connection-registry} health checks
 * and the {@code relay.connections.active} gauge. Requires a {@link RelayConfiguration} block
 * in the application's YAML config.
 * <p>
 * Embed in your application with the in-memory credential verifier (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new RelayBundle<>());
 * }</pre>
 * <p>
 * Or supply your own verifier:
 * <pre>{@code
 *   bootstrap.addBundle(new RelayBundle<>(myCredentialVerifier));
 * }</pre>
 * Subclasses may override {@link #registerHandlers} to route more event types.
 */
public class RelayBundle<C extends RelayConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(RelayBundle.class);

  /**
   * Name of the active connection gauge.
   */
  public static final String CONNECTIONS_GAUGE = "relay.connections.active";

  private final CredentialVerifier credentialVerifier;

  /**
   * Creates a bundle that checks logins against the {@code users} map in the configuration.
   * For dev/test only.
   */
  public RelayBundle() {
    this.credentialVerifier = null;
  }

  /**
   * Creates a bundle backed by the supplied credential verifier. {@code users} in the
   * configuration is ignored.
   *
   * @param credentialVerifier the verifier
   */
  public RelayBundle(final CredentialVerifier credentialVerifier) {
    this.credentialVerifier = credentialVerifier;
  }

  @Override
  public void initialize(final Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(final C configuration, final Environment environment) {
    ObjectMapper objectMapper = environment.getObjectMapper();
    Clock clock = Clock.systemUTC();

    TokenStore tokenStore = new InMemoryTokenStore(configuration.getTokenRetention().toJavaDuration(), clock);
    CredentialVerifier verifier = credentialVerifier != null
        ? credentialVerifier
        : new InMemoryCredentialVerifier(configuration.getUsers());

    EventRouter.Builder routes = EventRouter.builder();
    registerHandlers(routes, objectMapper, clock);
    EventRouter eventRouter = routes.build();
    log.info("Routing event types {}", eventRouter.types());

    ConnectionSettings settings = new ConnectionSettings(
        configuration.getPongWait().toJavaDuration(),
        configuration.getMaxMessageBytes(),
        configuration.getMailboxCapacity(),
        configuration.getInboundCapacity());
    ConnectionRegistry registry = new ConnectionRegistry(
        tokenStore,
        eventRouter,
        OriginPolicy.of(configuration.getAllowedOrigins()),
        settings,
        objectMapper);

    environment.jersey().register(new LoginResource(new LoginManager(verifier, tokenStore)));
    environment.jersey().register(new DebugResource(registry));

    // Jetty enforces its own frame limits too; keep them in line with the connection settings.
    Duration idleTimeout = settings.pongWait().multipliedBy(2);
    JettyWebSocketServletContainerInitializer.configure(environment.getApplicationContext(),
        (servletContext, container) -> {
          container.setIdleTimeout(idleTimeout);
          container.setMaxTextMessageSize(settings.maxMessageBytes());
          container.setMaxBinaryMessageSize(settings.maxMessageBytes());
        });
    environment.servlets()
        .addServlet("relay-admission", new AdmissionServlet(registry, settings.inboundCapacity(), clock))
        .addMapping(configuration.getWebsocketPath());

    environment.healthChecks().register("token-store", new TokenStoreHealthCheck(tokenStore));
    environment.healthChecks().register("connection-registry", new ConnectionRegistryHealthCheck(registry));
    environment.metrics().register(CONNECTIONS_GAUGE, (Gauge<Integer>) registry::size);
    environment.lifecycle().manage(new RelayLifecycle(registry, tokenStore));
  }

  /**
   * Registers the event handlers. The default routes {@value EventTypes#SEND_MESSAGE}.
   *
   * @param routes       the router under construction
   * @param objectMapper payload codec
   * @param clock        time source for handlers
   */
  protected void registerHandlers(final EventRouter.Builder routes,
                                  final ObjectMapper objectMapper,
                                  final Clock clock) {
    routes.on(EventTypes.SEND_MESSAGE, new SendMessageHandler(objectMapper, clock));
  }
}
