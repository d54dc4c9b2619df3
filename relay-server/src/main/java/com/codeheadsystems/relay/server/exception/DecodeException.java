package com.codeheadsystems.relay.server.exception;

/**
 * An inbound frame is not a valid envelope. Fatal to the connection that sent it.
 */
public class DecodeException extends RelayException {

  /**
   * Instantiates a new Decode exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DecodeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
