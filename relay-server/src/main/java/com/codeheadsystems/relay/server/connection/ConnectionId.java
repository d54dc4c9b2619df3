package com.codeheadsystems.relay.server.connection;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Opaque identity of a connection, used as the registry key.
 *
 * @param value process-unique sequence number
 */
public record ConnectionId(long value) {

  private static final AtomicLong SEQUENCE = new AtomicLong();

  /**
   * Allocates the next identifier.
   *
   * @return a new, never before returned identifier
   */
  public static ConnectionId next() {
    return new ConnectionId(SEQUENCE.incrementAndGet());
  }

  @Override
  public String toString() {
    return "conn-" + value;
  }
}
