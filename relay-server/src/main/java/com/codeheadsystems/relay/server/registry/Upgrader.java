package com.codeheadsystems.relay.server.registry;

import com.codeheadsystems.relay.server.connection.WebSocketStream;
import java.io.IOException;

/**
 * Performs the transport-level protocol switch for an admitted request.
 */
@FunctionalInterface
public interface Upgrader {

  /**
   * Upgrades the request.
   *
   * @return the stream of the upgraded connection
   * @throws IOException if the transport could not upgrade
   */
  WebSocketStream upgrade() throws IOException;
}
