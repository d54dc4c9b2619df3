package com.codeheadsystems.relay.server.store;

import java.time.Duration;
import java.time.Instant;

/**
 * A single-use admission token.
 *
 * @param key       opaque random key handed to the client
 * @param createdAt when the token was issued
 */
public record AccessToken(String key, Instant createdAt) {

  /**
   * Whether this token is older than the retention window at the given instant.
   *
   * @param now       the current time
   * @param retention the retention window
   * @return true if expired
   */
  public boolean isExpired(Instant now, Duration retention) {
    return createdAt.plus(retention).isBefore(now);
  }
}
