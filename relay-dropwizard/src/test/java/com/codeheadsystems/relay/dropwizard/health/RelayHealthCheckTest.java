package com.codeheadsystems.relay.dropwizard.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.relay.server.registry.ConnectionRegistry;
import com.codeheadsystems.relay.server.store.InMemoryTokenStore;
import com.codeheadsystems.relay.server.store.TokenStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RelayHealthCheckTest {

  @Mock private ConnectionRegistry registry;
  @Mock private TokenStore tokenStore;

  @Test
  void connectionRegistry_reportsLiveCount() {
    when(registry.size()).thenReturn(3);

    HealthCheck.Result result = new ConnectionRegistryHealthCheck(registry).execute();

    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getMessage()).isEqualTo("live connections=3");
  }

  @Test
  void tokenStore_reportsOutstandingTokens() {
    when(tokenStore.size()).thenReturn(2);

    HealthCheck.Result result = new TokenStoreHealthCheck(tokenStore).execute();

    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getMessage()).isEqualTo("outstanding tokens=2");
  }

  @Test
  void tokenStore_stoppedSweeper_isUnhealthy() {
    InMemoryTokenStore store = new InMemoryTokenStore();
    store.shutdown();

    HealthCheck.Result result = new TokenStoreHealthCheck(store).execute();

    assertThat(result.isHealthy()).isFalse();
  }
}
