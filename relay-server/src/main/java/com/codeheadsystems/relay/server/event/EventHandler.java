package com.codeheadsystems.relay.server.event;

import com.codeheadsystems.relay.model.Envelope;
import com.codeheadsystems.relay.server.connection.Connection;
import com.codeheadsystems.relay.server.exception.EventHandlerException;

/**
 * Processes one type of inbound envelope.
 * <p>
 * Handlers run on the read loop of the connection the envelope arrived on, so a handler
 * blocks further reads from that peer until it returns. It may queue envelopes on any
 * connection's mailbox.
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * Handles the envelope.
   *
   * @param envelope   the envelope, payload not yet decoded
   * @param connection the connection it arrived on
   * @throws EventHandlerException if the event could not be processed; the connection stays open
   */
  void handle(Envelope envelope, Connection connection) throws EventHandlerException;
}
