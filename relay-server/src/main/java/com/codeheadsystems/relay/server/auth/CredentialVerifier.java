package com.codeheadsystems.relay.server.auth;

/**
 * Checks a username/password pair before an admission token is issued.
 * <p>
 * Implementations must be thread-safe. Production implementations typically delegate to a
 * user directory or identity provider.
 */
public interface CredentialVerifier {

  /**
   * Verifies the credentials.
   *
   * @param username the account name
   * @param password the account password
   * @return true if the pair is valid
   */
  boolean verify(String username, String password);
}
