package com.codeheadsystems.relay.model;

/**
 * Event type tags carried in {@link Envelope#type()}.
 */
public final class EventTypes {

  /**
   * Inbound: a client posts a chat message. Payload is {@link SendMessageEvent}.
   */
  public static final String SEND_MESSAGE = "send_message";

  /**
   * Outbound: a chat message fanned out to every connection. Payload is {@link NewMessageEvent}.
   */
  public static final String NEW_MESSAGE = "new_message";

  private EventTypes() {
  }
}
