package com.codeheadsystems.relay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of the inbound {@value EventTypes#SEND_MESSAGE} event.
 *
 * @param message the chat message text
 * @param from    display name of the sender
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SendMessageEvent(
    @JsonProperty("message") String message,
    @JsonProperty("from") String from) {
}
