package com.codeheadsystems.relay.server.connection;

import java.time.Duration;

/**
 * Per-connection tuning.
 *
 * @param pongWait        how long the peer may stay silent (no pong) before the connection is
 *                        presumed dead
 * @param maxMessageBytes largest inbound message accepted, in bytes
 * @param mailboxCapacity outbound envelopes that may queue for one connection before further
 *                        ones are dropped
 * @param inboundCapacity inbound messages the transport may buffer ahead of the read loop
 *                        before it is made to wait
 */
public record ConnectionSettings(Duration pongWait, long maxMessageBytes, int mailboxCapacity,
                                 int inboundCapacity) {

  /**
   * Default pong wait.
   */
  public static final Duration DEFAULT_PONG_WAIT = Duration.ofSeconds(10);

  /**
   * Default maximum inbound message size.
   */
  public static final long DEFAULT_MAX_MESSAGE_BYTES = 1024;

  /**
   * Default mailbox capacity.
   */
  public static final int DEFAULT_MAILBOX_CAPACITY = 256;

  /**
   * Default inbound buffer capacity.
   */
  public static final int DEFAULT_INBOUND_CAPACITY = 16;

  /**
   * Validates the settings.
   */
  public ConnectionSettings {
    if (pongWait == null || pongWait.isNegative() || pongWait.isZero()) {
      throw new IllegalArgumentException("pongWait must be positive: " + pongWait);
    }
    if (maxMessageBytes < 1) {
      throw new IllegalArgumentException("maxMessageBytes must be positive: " + maxMessageBytes);
    }
    if (mailboxCapacity < 1) {
      throw new IllegalArgumentException("mailboxCapacity must be positive: " + mailboxCapacity);
    }
    if (inboundCapacity < 1) {
      throw new IllegalArgumentException("inboundCapacity must be positive: " + inboundCapacity);
    }
  }

  /**
   * Settings with the default inbound capacity.
   *
   * @param pongWait        the pong wait
   * @param maxMessageBytes the largest inbound message
   * @param mailboxCapacity the outbound mailbox capacity
   */
  public ConnectionSettings(final Duration pongWait, final long maxMessageBytes, final int mailboxCapacity) {
    this(pongWait, maxMessageBytes, mailboxCapacity, DEFAULT_INBOUND_CAPACITY);
  }

  /**
   * Settings with every default applied.
   *
   * @return the defaults
   */
  public static ConnectionSettings defaults() {
    return new ConnectionSettings(DEFAULT_PONG_WAIT, DEFAULT_MAX_MESSAGE_BYTES, DEFAULT_MAILBOX_CAPACITY);
  }

  /**
   * Interval between pings: nine tenths of the pong wait, so a ping always reaches the peer
   * before its read deadline on our side runs out.
   *
   * @return the ping interval
   */
  public Duration pingInterval() {
    return pongWait.multipliedBy(9).dividedBy(10);
  }
}
