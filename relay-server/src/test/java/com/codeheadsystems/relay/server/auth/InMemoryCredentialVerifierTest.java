package com.codeheadsystems.relay.server.auth;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryCredentialVerifierTest {

  private final InMemoryCredentialVerifier verifier = new InMemoryCredentialVerifier(Map.of("arti", "123"));

  @Test
  void verify_matchingPassword_returnsTrue() {
    assertThat(verifier.verify("arti", "123")).isTrue();
  }

  @Test
  void verify_wrongPasswordOrUnknownUser_returnsFalse() {
    assertThat(verifier.verify("arti", "1234")).isFalse();
    assertThat(verifier.verify("percy", "123")).isFalse();
    assertThat(verifier.verify(null, "123")).isFalse();
    assertThat(verifier.verify("arti", null)).isFalse();
  }
}
