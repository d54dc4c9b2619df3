package com.codeheadsystems.relay.server.connection;

/**
 * Lifecycle of a {@link Connection}. Transitions only move forward.
 */
public enum ConnectionState {
  /**
   * Upgraded and constructed, loops not yet started.
   */
  ADMITTED,
  /**
   * Registered, read and write loops running.
   */
  ACTIVE,
  /**
   * One of the loops has exited and cleanup is under way.
   */
  CLOSING,
  /**
   * Removed from the registry and stream closed. Terminal.
   */
  REMOVED
}
