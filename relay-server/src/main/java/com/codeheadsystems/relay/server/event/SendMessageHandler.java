package com.codeheadsystems.relay.server.event;

import com.codeheadsystems.relay.model.Envelope;
import com.codeheadsystems.relay.model.EventTypes;
import com.codeheadsystems.relay.model.NewMessageEvent;
import com.codeheadsystems.relay.model.SendMessageEvent;
import com.codeheadsystems.relay.server.connection.Connection;
import com.codeheadsystems.relay.server.exception.EventHandlerException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles {@value EventTypes#SEND_MESSAGE}: decodes the chat message and fans it out as
 * {@value EventTypes#NEW_MESSAGE} to every live connection, the sender included.
 */
public class SendMessageHandler implements EventHandler {

  private static final Logger log = LoggerFactory.getLogger(SendMessageHandler.class);

  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Instantiates a new Send message handler.
   *
   * @param objectMapper payload codec
   * @param clock        source of the {@code sent} timestamp
   */
  public SendMessageHandler(final ObjectMapper objectMapper, final Clock clock) {
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public void handle(final Envelope envelope, final Connection connection) throws EventHandlerException {
    SendMessageEvent event = decode(envelope);
    log.debug("send_message from={} on {}", event.from(), connection.id());
    NewMessageEvent outbound = NewMessageEvent.of(event, clock.instant());
    Envelope broadcast = new Envelope(EventTypes.NEW_MESSAGE, objectMapper.valueToTree(outbound));
    connection.registry().broadcast(broadcast);
  }

  private SendMessageEvent decode(final Envelope envelope) throws EventHandlerException {
    if (envelope.payload() == null || envelope.payload().isNull()) {
      throw new EventHandlerException("send_message requires a payload");
    }
    SendMessageEvent event;
    try {
      event = objectMapper.treeToValue(envelope.payload(), SendMessageEvent.class);
    } catch (JsonProcessingException e) {
      throw new EventHandlerException("bad payload in request: " + e.getOriginalMessage(), e);
    }
    if (event.message() == null || event.from() == null) {
      throw new EventHandlerException("send_message requires message and from");
    }
    return event;
  }
}
