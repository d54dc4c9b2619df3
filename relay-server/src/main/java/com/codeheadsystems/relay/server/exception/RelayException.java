package com.codeheadsystems.relay.server.exception;

/**
 * Base type of the relay's domain failures.
 * <p>
 * Admission failures ({@link UnauthorizedException}, {@link UpgradeFailedException}) are
 * surfaced to the caller as HTTP statuses. Connection-level failures are either fatal to the
 * connection ({@link DecodeException}) or logged while the connection keeps serving
 * ({@link UnsupportedEventException}, {@link EventHandlerException}).
 */
public abstract class RelayException extends Exception {

  /**
   * Instantiates a new Relay exception.
   *
   * @param message the message
   */
  protected RelayException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Relay exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  protected RelayException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
