package com.codeheadsystems.relay.server.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link TokenStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired tokens are rejected on {@link #verify} and evicted by a daemon sweeper that runs
 * once per retention window, which bounds memory even when clients never redeem their tokens.
 * Call {@link #shutdown()} to stop the sweeper.
 */
public class InMemoryTokenStore implements TokenStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryTokenStore.class);

  /**
   * Default retention window for issued tokens.
   */
  public static final Duration DEFAULT_RETENTION = Duration.ofSeconds(20);

  private final ConcurrentHashMap<String, AccessToken> tokens = new ConcurrentHashMap<>();
  private final Duration retention;
  private final Clock clock;
  private final ScheduledExecutorService sweeper;

  /**
   * Creates a store with the default retention window and the system clock.
   */
  public InMemoryTokenStore() {
    this(DEFAULT_RETENTION);
  }

  /**
   * Creates a store with the given retention window and the system clock.
   *
   * @param retention how long an unredeemed token stays valid
   */
  public InMemoryTokenStore(final Duration retention) {
    this(retention, Clock.systemUTC());
  }

  /**
   * Creates a store with the given retention window and clock.
   *
   * @param retention how long an unredeemed token stays valid
   * @param clock     time source for issuance and expiry
   */
  public InMemoryTokenStore(final Duration retention, final Clock clock) {
    if (retention.isNegative() || retention.isZero()) {
      throw new IllegalArgumentException("retention must be positive: " + retention);
    }
    this.retention = retention;
    this.clock = clock;
    this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "relay-token-sweeper");
      t.setDaemon(true);
      return t;
    });
    long periodMillis = retention.toMillis();
    sweeper.scheduleAtFixedRate(this::sweep, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
  }

  @Override
  public AccessToken issue() {
    AccessToken token = new AccessToken(UUID.randomUUID().toString(), clock.instant());
    tokens.put(token.key(), token);
    log.debug("Issued token, {} outstanding", tokens.size());
    return token;
  }

  @Override
  public boolean verify(final String key) {
    if (key == null || key.isBlank()) {
      return false;
    }
    AccessToken token = tokens.remove(key);
    if (token == null) {
      log.debug("Token not found (never issued, already used or swept)");
      return false;
    }
    if (token.isExpired(clock.instant(), retention)) {
      log.debug("Token expired at verification");
      return false;
    }
    return true;
  }

  @Override
  public int size() {
    return tokens.size();
  }

  /**
   * Removes every token older than the retention window.
   */
  public void sweep() {
    Instant now = clock.instant();
    int before = tokens.size();
    tokens.values().removeIf(token -> token.isExpired(now, retention));
    int removed = before - tokens.size();
    if (removed > 0) {
      log.debug("Swept {} expired token(s)", removed);
    }
  }

  /**
   * Whether the background sweeper has been stopped.
   *
   * @return true after {@link #shutdown()}
   */
  public boolean isShutdown() {
    return sweeper.isShutdown();
  }

  /**
   * Gets the retention window.
   *
   * @return the retention
   */
  public Duration retention() {
    return retention;
  }

  @Override
  public void shutdown() {
    sweeper.shutdownNow();
    log.info("Token sweeper stopped");
  }
}
