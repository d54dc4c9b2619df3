package com.codeheadsystems.relay.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.relay.server.store.InMemoryTokenStore;
import com.codeheadsystems.relay.server.store.TokenStore;

/**
 * Health check reporting outstanding admission tokens. Unhealthy once the in-memory store's
 * sweeper has stopped, since expired tokens would then pile up.
 */
public class TokenStoreHealthCheck extends HealthCheck {

  private final TokenStore tokenStore;

  /**
   * Instantiates a new Token store health check.
   *
   * @param tokenStore the token store
   */
  public TokenStoreHealthCheck(final TokenStore tokenStore) {
    this.tokenStore = tokenStore;
  }

  @Override
  protected Result check() {
    if (tokenStore instanceof InMemoryTokenStore inMemory && inMemory.isShutdown()) {
      return Result.unhealthy("Token sweeper is stopped");
    }
    return Result.healthy("outstanding tokens=%d", tokenStore.size());
  }
}
