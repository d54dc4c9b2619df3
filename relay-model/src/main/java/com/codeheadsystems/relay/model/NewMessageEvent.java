package com.codeheadsystems.relay.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Payload of the outbound {@value EventTypes#NEW_MESSAGE} event. Carries the original
 * message plus the server time it was accepted.
 *
 * @param message the chat message text
 * @param from    display name of the sender
 * @param sent    ISO-8601 server timestamp of when the message was accepted
 */
public record NewMessageEvent(
    @JsonProperty("message") String message,
    @JsonProperty("from") String from,
    @JsonProperty("sent") String sent) {

  /**
   * Builds the outbound event for an accepted inbound message.
   *
   * @param event the inbound event
   * @param sent  acceptance time
   * @return the outbound event
   */
  public static NewMessageEvent of(SendMessageEvent event, Instant sent) {
    return new NewMessageEvent(event.message(), event.from(), sent.toString());
  }
}
