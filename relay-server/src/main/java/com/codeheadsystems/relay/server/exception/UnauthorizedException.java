package com.codeheadsystems.relay.server.exception;

/**
 * Admission token missing, unknown, expired or already used. Maps to HTTP 401.
 */
public class UnauthorizedException extends RelayException {

  /**
   * Instantiates a new Unauthorized exception.
   *
   * @param message the message
   */
  public UnauthorizedException(final String message) {
    super(message);
  }
}
