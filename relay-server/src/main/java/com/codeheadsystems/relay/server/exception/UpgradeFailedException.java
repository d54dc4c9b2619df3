package com.codeheadsystems.relay.server.exception;

/**
 * The transport could not switch the admitted request to a WebSocket connection.
 */
public class UpgradeFailedException extends RelayException {

  /**
   * Instantiates a new Upgrade failed exception.
   *
   * @param message the message
   */
  public UpgradeFailedException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Upgrade failed exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public UpgradeFailedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
