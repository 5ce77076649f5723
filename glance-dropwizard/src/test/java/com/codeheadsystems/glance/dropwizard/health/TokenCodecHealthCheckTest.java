package com.codeheadsystems.glance.dropwizard.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.glance.server.auth.TokenManager;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TokenCodecHealthCheckTest {

  private static final byte[] SECRET = new byte[32];

  @Test
  void check_realCodec_isHealthy() {
    HealthCheck.Result result =
        new TokenCodecHealthCheck(new TokenManager(SECRET, "glance-test", 3600)).execute();

    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getMessage()).isEqualTo("token ttl=3600s");
  }

  @Test
  void check_verificationFails_isUnhealthy() {
    TokenManager tokenManager = mock(TokenManager.class);
    when(tokenManager.issue(anyString())).thenReturn(
        new TokenManager.IssuedToken("t", TokenManager.SCOPE, 60, Instant.EPOCH));
    when(tokenManager.verify("t")).thenReturn(Optional.empty());

    HealthCheck.Result result = new TokenCodecHealthCheck(tokenManager).execute();

    assertThat(result.isHealthy()).isFalse();
    assertThat(result.getMessage()).contains("failed verification");
  }

  @Test
  void check_codecThrows_isUnhealthy() {
    TokenManager tokenManager = mock(TokenManager.class);
    when(tokenManager.issue(anyString())).thenThrow(new IllegalStateException("no key"));

    HealthCheck.Result result = new TokenCodecHealthCheck(tokenManager).execute();

    assertThat(result.isHealthy()).isFalse();
    assertThat(result.getError()).isInstanceOf(IllegalStateException.class);
  }
}
