package com.codeheadsystems.relay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Wire model for every message exchanged over an established relay connection, in both
 * directions.
 * <p>
 * The envelope is decoded once at the transport boundary. The {@code payload} is kept as an
 * undecoded JSON tree so the router never needs to know every payload schema; the handler
 * registered for {@code type} performs the second decode into its own record.
 * <pre>{@code
 *   {"type": "send_message", "payload": {"message": "hi", "from": "a"}}
 * }</pre>
 *
 * @param type    event type tag used to select a handler, see {@link EventTypes}
 * @param payload raw JSON payload, may be {@code null} when the sender omitted it
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Envelope(
    @JsonProperty("type") String type,
    @JsonProperty("payload") JsonNode payload) {
}
