package com.codeheadsystems.relay.server.store;

/**
 * Issues and redeems short-lived single-use admission tokens.
 * <p>
 * Implementations must be thread-safe: issue, verify and any background expiry may run
 * concurrently. A token is valid from issuance until it is verified once or its retention
 * window elapses, whichever comes first.
 */
public interface TokenStore {

  /**
   * Issues a fresh token.
   *
   * @return the new token
   */
  AccessToken issue();

  /**
   * Redeems a token. A successful verification consumes it, so a second call with the same
   * key returns false.
   *
   * @param key the token key presented by the client
   * @return true if the key was issued, unused and not expired
   */
  boolean verify(String key);

  /**
   * Number of tokens currently held, including expired ones not yet swept.
   *
   * @return the count
   */
  int size();

  /**
   * Stops any background work. After shutdown the store no longer expires entries on its own.
   */
  void shutdown();
}
