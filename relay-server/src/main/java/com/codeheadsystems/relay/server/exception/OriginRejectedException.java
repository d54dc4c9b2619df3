package com.codeheadsystems.relay.server.exception;

/**
 * The request's {@code Origin} header is not accepted by the configured origin policy.
 * Maps to HTTP 403.
 */
public class OriginRejectedException extends UpgradeFailedException {

  /**
   * Instantiates a new Origin rejected exception.
   *
   * @param origin the rejected origin
   */
  public OriginRejectedException(final String origin) {
    super("Origin not allowed: " + origin);
  }
}
