package com.codeheadsystems.relay.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import io.dropwizard.util.Duration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dropwizard configuration for the relay.
 * <p>
 * The ping interval is not configured directly: it is always nine tenths of
 * {@code pongWait}, so a ping reaches the peer before our read deadline for it expires.
 * <p>
 * {@code users} feeds the development-only in-memory credential verifier and is ignored when
 * the bundle is given its own {@code CredentialVerifier}.
 */
public class RelayConfiguration extends Configuration {

  /**
   * How long a connection may go without a pong before it is dropped.
   */
  @NotNull
  private Duration pongWait = Duration.seconds(10);

  /**
   * How long an issued admission token stays redeemable.
   */
  @NotNull
  private Duration tokenRetention = Duration.seconds(20);

  /**
   * Largest inbound WebSocket message accepted, in bytes.
   */
  @Min(1)
  private long maxMessageBytes = 1024;

  /**
   * Outbound envelopes that may queue for a single connection before new ones are dropped.
   */
  @Min(1)
  private int mailboxCapacity = 256;

  /**
   * Inbound messages buffered ahead of a connection's read loop before Jetty is made to wait.
   */
  @Min(1)
  private int inboundCapacity = 16;

  /**
   * Origins allowed to open connections. Empty allows every origin.
   */
  @NotNull
  private List<String> allowedOrigins = new ArrayList<>();

  /**
   * Username to password pairs for the in-memory credential verifier (dev/test only).
   */
  @NotNull
  private Map<String, String> users = new HashMap<>();

  /**
   * Servlet path of the admission endpoint.
   */
  @NotEmpty
  private String websocketPath = "/ws";

  /**
   * Gets pong wait.
   *
   * @return the pong wait
   */
  @JsonProperty
  public Duration getPongWait() {
    return pongWait;
  }

  /**
   * Sets pong wait.
   *
   * @param pongWait the pong wait
   */
  @JsonProperty
  public void setPongWait(Duration pongWait) {
    this.pongWait = pongWait;
  }

  /**
   * Gets token retention.
   *
   * @return the token retention
   */
  @JsonProperty
  public Duration getTokenRetention() {
    return tokenRetention;
  }

  /**
   * Sets token retention.
   *
   * @param tokenRetention the token retention
   */
  @JsonProperty
  public void setTokenRetention(Duration tokenRetention) {
    this.tokenRetention = tokenRetention;
  }

  /**
   * Gets max message bytes.
   *
   * @return the max message bytes
   */
  @JsonProperty
  public long getMaxMessageBytes() {
    return maxMessageBytes;
  }

  /**
   * Sets max message bytes.
   *
   * @param maxMessageBytes the max message bytes
   */
  @JsonProperty
  public void setMaxMessageBytes(long maxMessageBytes) {
    this.maxMessageBytes = maxMessageBytes;
  }

  /**
   * Gets mailbox capacity.
   *
   * @return the mailbox capacity
   */
  @JsonProperty
  public int getMailboxCapacity() {
    return mailboxCapacity;
  }

  /**
   * Sets mailbox capacity.
   *
   * @param mailboxCapacity the mailbox capacity
   */
  @JsonProperty
  public void setMailboxCapacity(int mailboxCapacity) {
    this.mailboxCapacity = mailboxCapacity;
  }

  /**
   * Gets inbound capacity.
   *
   * @return the inbound capacity
   */
  @JsonProperty
  public int getInboundCapacity() {
    return inboundCapacity;
  }

  /**
   * Sets inbound capacity.
   *
   * @param inboundCapacity the inbound capacity
   */
  @JsonProperty
  public void setInboundCapacity(int inboundCapacity) {
    this.inboundCapacity = inboundCapacity;
  }

  /**
   * Gets allowed origins.
   *
   * @return the allowed origins
   */
  @JsonProperty
  public List<String> getAllowedOrigins() {
    return allowedOrigins;
  }

  /**
   * Sets allowed origins.
   *
   * @param allowedOrigins the allowed origins
   */
  @JsonProperty
  public void setAllowedOrigins(List<String> allowedOrigins) {
    this.allowedOrigins = allowedOrigins;
  }

  /**
   * Gets users.
   *
   * @return the users
   */
  @JsonProperty
  public Map<String, String> getUsers() {
    return users;
  }

  /**
   * Sets users.
   *
   * @param users the users
   */
  @JsonProperty
  public void setUsers(Map<String, String> users) {
    this.users = users;
  }

  /**
   * Gets websocket path.
   *
   * @return the websocket path
   */
  @JsonProperty
  public String getWebsocketPath() {
    return websocketPath;
  }

  /**
   * Sets websocket path.
   *
   * @param websocketPath the websocket path
   */
  @JsonProperty
  public void setWebsocketPath(String websocketPath) {
    this.websocketPath = websocketPath;
  }
}
