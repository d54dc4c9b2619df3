package com.codeheadsystems.relay.server.connection;

import java.io.IOException;
import java.time.Instant;

/**
 * No data or pong arrived before the read deadline.
 */
public class ReadDeadlineExceededException extends IOException {

  /**
   * Instantiates a new Read deadline exceeded exception.
   *
   * @param deadline the deadline that passed
   */
  public ReadDeadlineExceededException(final Instant deadline) {
    super("read deadline exceeded: " + deadline);
  }
}
