package com.codeheadsystems.relay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the token-issuance request.
 * <p>
 * The credentials are checked by the server's credential verifier; on success the server
 * answers with a {@link LoginResponse} carrying a one-time token the client must present
 * within the retention window to open a connection.
 * <p>
 * Used by: {@code POST /login}
 *
 * @param username the account name
 * @param password the account password
 */
public record LoginRequest(
    @JsonProperty("username") String username,
    @JsonProperty("password") String password) {

  @Override
  public String toString() {
    return "LoginRequest[username=" + username + ", password=***]";
  }
}
