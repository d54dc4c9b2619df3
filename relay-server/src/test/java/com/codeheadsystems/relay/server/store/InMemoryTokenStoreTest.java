package com.codeheadsystems.relay.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.relay.server.Await;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type In memory token store test.
 */
class InMemoryTokenStoreTest {

  private MutableClock clock;
  private InMemoryTokenStore store;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    store = new InMemoryTokenStore(InMemoryTokenStore.DEFAULT_RETENTION, clock);
  }

  @AfterEach
  void tearDown() {
    store.shutdown();
  }

  @Test
  void issue_returnsUniqueKeys() {
    AccessToken first = store.issue();
    AccessToken second = store.issue();

    assertThat(first.key()).isNotBlank().isNotEqualTo(second.key());
    assertThat(first.createdAt()).isEqualTo(clock.instant());
    assertThat(store.size()).isEqualTo(2);
  }

  /**
   * A token redeems once; the second attempt fails.
   */
  @Test
  void verify_freshToken_succeedsOnce() {
    AccessToken token = store.issue();

    assertThat(store.verify(token.key())).isTrue();
    assertThat(store.verify(token.key())).isFalse();
    assertThat(store.size()).isZero();
  }

  @Test
  void verify_unknownOrBlank_returnsFalse() {
    store.issue();

    assertThat(store.verify("never-issued")).isFalse();
    assertThat(store.verify("")).isFalse();
    assertThat(store.verify("   ")).isFalse();
    assertThat(store.verify(null)).isFalse();
    assertThat(store.size()).isEqualTo(1);
  }

  @Test
  void verify_atRetentionBoundary_succeeds() {
    AccessToken token = store.issue();
    clock.advance(InMemoryTokenStore.DEFAULT_RETENTION);

    assertThat(store.verify(token.key())).isTrue();
  }

  @Test
  void verify_expiredToken_failsAndIsConsumed() {
    AccessToken token = store.issue();
    clock.advance(Duration.ofSeconds(21));

    assertThat(store.verify(token.key())).isFalse();
    assertThat(store.size()).isZero();
  }

  /**
   * Sweep removes only expired tokens.
   */
  @Test
  void sweep_removesOnlyExpiredTokens() {
    AccessToken old = store.issue();
    clock.advance(Duration.ofSeconds(15));
    AccessToken young = store.issue();
    clock.advance(Duration.ofSeconds(10));

    store.sweep();

    assertThat(store.size()).isEqualTo(1);
    assertThat(store.verify(old.key())).isFalse();
    assertThat(store.verify(young.key())).isTrue();
  }

  @Test
  void backgroundSweeper_evictsUnredeemedTokens() throws Exception {
    InMemoryTokenStore fast = new InMemoryTokenStore(Duration.ofMillis(50));
    try {
      fast.issue();
      fast.issue();
      Await.until(Duration.ofSeconds(2), () -> fast.size() == 0);
    } finally {
      fast.shutdown();
    }
  }

  @Test
  void shutdown_stopsSweeper() throws Exception {
    InMemoryTokenStore fast = new InMemoryTokenStore(Duration.ofMillis(50));
    fast.shutdown();
    fast.issue();
    Thread.sleep(300);

    assertThat(fast.isShutdown()).isTrue();
    assertThat(fast.size()).isEqualTo(1);
  }

  @Test
  void constructor_nonPositiveRetention_throws() {
    assertThatThrownBy(() -> new InMemoryTokenStore(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }

  /**
   * Concurrent redemption of one token succeeds for exactly one caller.
   */
  @Test
  void verify_concurrentRedemption_succeedsExactlyOnce() throws Exception {
    AccessToken token = store.issue();
    int threads = 16;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        results.add(executor.submit(() -> {
          start.await();
          return store.verify(token.key());
        }));
      }
      start.countDown();
      int successes = 0;
      for (Future<Boolean> result : results) {
        if (result.get(5, TimeUnit.SECONDS)) {
          successes++;
        }
      }
      assertThat(successes).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }
  }
}
