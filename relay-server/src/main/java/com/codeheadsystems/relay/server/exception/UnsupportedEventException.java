package com.codeheadsystems.relay.server.exception;

/**
 * No handler is registered for an envelope's type.
 */
public class UnsupportedEventException extends RelayException {

  private final String type;

  /**
   * Instantiates a new Unsupported event exception.
   *
   * @param type the unrouted event type, may be null
   */
  public UnsupportedEventException(final String type) {
    super("this event type is not supported: " + type);
    this.type = type;
  }

  /**
   * Gets the unrouted event type.
   *
   * @return the type, may be null
   */
  public String type() {
    return type;
  }
}
