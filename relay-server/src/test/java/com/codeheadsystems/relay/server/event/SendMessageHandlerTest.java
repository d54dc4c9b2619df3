package com.codeheadsystems.relay.server.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.relay.model.Envelope;
import com.codeheadsystems.relay.model.EventTypes;
import com.codeheadsystems.relay.model.NewMessageEvent;
import com.codeheadsystems.relay.server.connection.Connection;
import com.codeheadsystems.relay.server.connection.ConnectionId;
import com.codeheadsystems.relay.server.exception.EventHandlerException;
import com.codeheadsystems.relay.server.registry.ConnectionRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SendMessageHandlerTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Mock private Connection connection;
  @Mock private ConnectionRegistry registry;

  private SendMessageHandler handler;

  @BeforeEach
  void setUp() {
    handler = new SendMessageHandler(objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void handle_broadcastsNewMessage() throws Exception {
    when(connection.id()).thenReturn(ConnectionId.next());
    when(connection.registry()).thenReturn(registry);
    Envelope inbound = objectMapper.readValue(
        "{\"type\":\"send_message\",\"payload\":{\"message\":\"hi\",\"from\":\"arti\"}}", Envelope.class);

    handler.handle(inbound, connection);

    ArgumentCaptor<Envelope> captor = ArgumentCaptor.forClass(Envelope.class);
    verify(registry).broadcast(captor.capture());
    Envelope outbound = captor.getValue();
    assertThat(outbound.type()).isEqualTo(EventTypes.NEW_MESSAGE);
    assertThat(objectMapper.treeToValue(outbound.payload(), NewMessageEvent.class))
        .isEqualTo(new NewMessageEvent("hi", "arti", NOW.toString()));
  }

  @Test
  void handle_missingPayload_throws() {
    assertThatThrownBy(() -> handler.handle(new Envelope(EventTypes.SEND_MESSAGE, null), connection))
        .isInstanceOf(EventHandlerException.class);
    verifyNoInteractions(connection);
  }

  @Test
  void handle_missingFields_throws() throws Exception {
    Envelope inbound = objectMapper.readValue(
        "{\"type\":\"send_message\",\"payload\":{\"message\":\"hi\"}}", Envelope.class);

    assertThatThrownBy(() -> handler.handle(inbound, connection))
        .isInstanceOf(EventHandlerException.class);
  }

  @Test
  void handle_wrongPayloadShape_throws() throws Exception {
    Envelope inbound = objectMapper.readValue(
        "{\"type\":\"send_message\",\"payload\":[1,2,3]}", Envelope.class);

    assertThatThrownBy(() -> handler.handle(inbound, connection))
        .isInstanceOf(EventHandlerException.class)
        .hasMessageContaining("bad payload");
  }
}
