package com.codeheadsystems.relay.server.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CredentialVerifier} over a fixed map of plaintext username/password pairs.
 * <p>
 * Passwords are held in memory as configured. Suitable for development and integration
 * testing only.
 */
public class InMemoryCredentialVerifier implements CredentialVerifier {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialVerifier.class);

  private final Map<String, String> users;

  /**
   * Instantiates a new In memory credential verifier.
   *
   * @param users username to password
   */
  public InMemoryCredentialVerifier(final Map<String, String> users) {
    this.users = Map.copyOf(users);
    log.warn("Using InMemoryCredentialVerifier with {} configured user(s). "
        + "Replace with a real CredentialVerifier for production.", this.users.size());
  }

  @Override
  public boolean verify(final String username, final String password) {
    if (username == null || password == null) {
      return false;
    }
    String expected = users.get(username);
    if (expected == null) {
      log.debug("Unknown user");
      return false;
    }
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8),
        password.getBytes(StandardCharsets.UTF_8));
  }
}
