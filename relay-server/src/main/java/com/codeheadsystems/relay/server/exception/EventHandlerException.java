package com.codeheadsystems.relay.server.exception;

/**
 * A handler reported a failure while processing an event.
 */
public class EventHandlerException extends RelayException {

  /**
   * Instantiates a new Event handler exception.
   *
   * @param message the message
   */
  public EventHandlerException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Event handler exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public EventHandlerException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
