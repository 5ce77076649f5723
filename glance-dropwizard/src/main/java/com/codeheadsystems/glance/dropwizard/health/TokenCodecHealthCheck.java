package com.codeheadsystems.glance.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.glance.server.auth.TokenManager;
import java.util.Optional;

/**
 * Health check that issues a throwaway token and verifies it with the same codec.
 */
public class TokenCodecHealthCheck extends HealthCheck {

  static final String SELF_TEST_CLIENT_ID = "health-check";

  private final TokenManager tokenManager;

  /**
   * Instantiates a new Token codec health check.
   *
   * @param tokenManager the token manager
   */
  public TokenCodecHealthCheck(TokenManager tokenManager) {
    this.tokenManager = tokenManager;
  }

  @Override
  protected Result check() {
    TokenManager.IssuedToken issued = tokenManager.issue(SELF_TEST_CLIENT_ID);
    Optional<TokenManager.TokenClaims> claims = tokenManager.verify(issued.token());
    if (claims.isEmpty()) {
      return Result.unhealthy("Freshly issued token failed verification");
    }
    if (!SELF_TEST_CLIENT_ID.equals(claims.get().clientId())) {
      return Result.unhealthy("Verified token carries client id %s", claims.get().clientId());
    }
    return Result.healthy("token ttl=%ds", tokenManager.ttlSeconds());
  }
}
