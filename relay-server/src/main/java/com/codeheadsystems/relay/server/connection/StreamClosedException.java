package com.codeheadsystems.relay.server.connection;

import java.io.IOException;
import java.util.Set;

/**
 * The peer closed the stream, or the stream was closed locally while a read was pending.
 */
public class StreamClosedException extends IOException {

  /**
   * Normal closure.
   */
  public static final int NORMAL = 1000;

  /**
   * Endpoint going away, e.g. a browser tab closed.
   */
  public static final int GOING_AWAY = 1001;

  /**
   * Connection dropped without a close frame.
   */
  public static final int ABNORMAL = 1006;

  private static final Set<Integer> EXPECTED = Set.of(NORMAL, GOING_AWAY, ABNORMAL);

  private final int statusCode;

  /**
   * Instantiates a new Stream closed exception.
   *
   * @param statusCode the close status code
   * @param reason     the close reason, may be null
   */
  public StreamClosedException(final int statusCode, final String reason) {
    super("stream closed: " + statusCode + (reason == null || reason.isEmpty() ? "" : " " + reason));
    this.statusCode = statusCode;
  }

  /**
   * Gets the close status code.
   *
   * @return the status code
   */
  public int statusCode() {
    return statusCode;
  }

  /**
   * Whether this is an ordinary disconnect that does not deserve a warning.
   *
   * @return true for normal, going-away and abnormal closure
   */
  public boolean isExpected() {
    return EXPECTED.contains(statusCode);
  }
}
