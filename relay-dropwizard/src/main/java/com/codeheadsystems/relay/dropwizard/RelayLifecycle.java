package com.codeheadsystems.relay.dropwizard;

import com.codeheadsystems.relay.server.registry.ConnectionRegistry;
import com.codeheadsystems.relay.server.store.TokenStore;
import io.dropwizard.lifecycle.Managed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ties the registry and token store to the application lifecycle. On stop, live connections
 * are asked to close and the token sweeper is halted.
 */
public class RelayLifecycle implements Managed {

  private static final Logger log = LoggerFactory.getLogger(RelayLifecycle.class);

  private final ConnectionRegistry registry;
  private final TokenStore tokenStore;

  /**
   * Instantiates a new Relay lifecycle.
   *
   * @param registry   the registry
   * @param tokenStore the token store
   */
  public RelayLifecycle(final ConnectionRegistry registry, final TokenStore tokenStore) {
    this.registry = registry;
    this.tokenStore = tokenStore;
  }

  @Override
  public void start() {
    log.info("Relay started");
  }

  @Override
  public void stop() {
    registry.shutdown();
    tokenStore.shutdown();
    log.info("Relay stopped");
  }
}
