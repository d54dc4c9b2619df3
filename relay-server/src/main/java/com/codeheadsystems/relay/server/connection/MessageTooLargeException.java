package com.codeheadsystems.relay.server.connection;

import java.io.IOException;

/**
 * An inbound message exceeded the stream's read limit.
 */
public class MessageTooLargeException extends IOException {

  /**
   * Instantiates a new Message too large exception.
   *
   * @param size  the message size in bytes
   * @param limit the read limit in bytes
   */
  public MessageTooLargeException(final long size, final long limit) {
    super("message of " + size + " bytes exceeds read limit of " + limit);
  }
}
