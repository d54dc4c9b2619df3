package com.codeheadsystems.relay.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.relay.server.registry.ConnectionRegistry;

/**
 * Health check reporting the live connection count.
 */
public class ConnectionRegistryHealthCheck extends HealthCheck {

  private final ConnectionRegistry registry;

  /**
   * Instantiates a new Connection registry health check.
   *
   * @param registry the registry
   */
  public ConnectionRegistryHealthCheck(final ConnectionRegistry registry) {
    this.registry = registry;
  }

  @Override
  protected Result check() {
    return Result.healthy("live connections=%d", registry.size());
  }
}
