package com.codeheadsystems.relay.server.manager;

import com.codeheadsystems.relay.model.LoginRequest;
import com.codeheadsystems.relay.model.LoginResponse;
import com.codeheadsystems.relay.server.auth.CredentialVerifier;
import com.codeheadsystems.relay.server.store.AccessToken;
import com.codeheadsystems.relay.server.store.TokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic token issuance: checks credentials and hands out a one-time admission
 * token.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException}: missing request data → HTTP 400</li>
 *   <li>{@link SecurityException}: credentials rejected → HTTP 401</li>
 * </ul>
 */
public class LoginManager {

  private static final Logger log = LoggerFactory.getLogger(LoginManager.class);

  private final CredentialVerifier credentialVerifier;
  private final TokenStore tokenStore;

  /**
   * Instantiates a new Login manager.
   *
   * @param credentialVerifier checks username/password pairs
   * @param tokenStore         issues admission tokens
   */
  public LoginManager(final CredentialVerifier credentialVerifier, final TokenStore tokenStore) {
    this.credentialVerifier = credentialVerifier;
    this.tokenStore = tokenStore;
  }

  /**
   * Verifies the credentials and issues a token.
   *
   * @param request the login request
   * @return the response carrying the token
   * @throws IllegalArgumentException if the request or one of its fields is missing
   * @throws SecurityException        if the credentials are rejected
   */
  public LoginResponse login(final LoginRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Missing request body");
    }
    if (request.username() == null || request.username().isBlank()) {
      throw new IllegalArgumentException("Missing required field: username");
    }
    if (request.password() == null) {
      throw new IllegalArgumentException("Missing required field: password");
    }
    if (!credentialVerifier.verify(request.username(), request.password())) {
      log.debug("login rejected for {}", request.username());
      throw new SecurityException("Authentication failed");
    }
    AccessToken token = tokenStore.issue();
    log.debug("login accepted for {}", request.username());
    return new LoginResponse(token.key());
  }
}
