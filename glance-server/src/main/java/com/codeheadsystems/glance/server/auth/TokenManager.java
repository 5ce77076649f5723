package com.codeheadsystems.glance.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies the gateway's bearer tokens.
 * <p>
 * Tokens are HMAC-SHA256 signed JWTs carrying the client identifier and scope. There is no
 * server-side record of an issued token: validity is decided by signature, issuer and the
 * embedded expiry alone, so a token cannot be revoked before it expires.
 */
public class TokenManager {

  /**
   * Scope granted to every token.
   */
  public static final String SCOPE = "mcp:tools";

  static final String CLIENT_ID_CLAIM = "client_id";
  static final String SCOPE_CLAIM = "scope";

  private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final long ttlSeconds;
  private final Clock clock;

  /**
   * Creates a new TokenManager using the system clock.
   *
   * @param secret     HMAC-SHA256 signing secret
   * @param issuer     JWT issuer claim
   * @param ttlSeconds token time-to-live in seconds
   */
  public TokenManager(byte[] secret, String issuer, long ttlSeconds) {
    this(secret, issuer, ttlSeconds, Clock.systemUTC());
  }

  /**
   * Creates a new TokenManager.
   *
   * @param secret     HMAC-SHA256 signing secret
   * @param issuer     JWT issuer claim
   * @param ttlSeconds token time-to-live in seconds
   * @param clock      source of the current time for issuance and expiry checks
   */
  public TokenManager(byte[] secret, String issuer, long ttlSeconds, Clock clock) {
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm)
        .withIssuer(issuer)
        .withClaimPresence(CLIENT_ID_CLAIM)
        // a token is still valid during the second named by its exp claim
        .acceptExpiresAt(1))
        .build(clock);
    this.issuer = issuer;
    this.ttlSeconds = ttlSeconds;
    this.clock = clock;
  }

  /**
   * Issues a token for the given client.
   *
   * @param clientId the client identifier
   * @return the signed token and its expiry
   */
  public IssuedToken issue(String clientId) {
    Instant now = clock.instant();
    Instant expiresAt = now.plusSeconds(ttlSeconds);
    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(UUID.randomUUID().toString())
        .withSubject(clientId)
        .withClaim(CLIENT_ID_CLAIM, clientId)
        .withClaim(SCOPE_CLAIM, SCOPE)
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);
    log.debug("Issued token for client_id={} expiring {}", clientId, expiresAt);
    return new IssuedToken(token, SCOPE, ttlSeconds, expiresAt);
  }

  /**
   * Verifies a token. Never throws: any signature, format, issuer or expiry problem yields
   * empty.
   *
   * @param token the token, may be null
   * @return the claims if the token is valid
   */
  public Optional<TokenClaims> verify(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      DecodedJWT decoded = verifier.verify(token);
      return Optional.of(new TokenClaims(
          decoded.getClaim(CLIENT_ID_CLAIM).asString(),
          decoded.getClaim(SCOPE_CLAIM).asString(),
          decoded.getIssuedAtAsInstant(),
          decoded.getExpiresAtAsInstant()));
    } catch (JWTVerificationException e) {
      log.debug("Token verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Token lifetime in seconds.
   *
   * @return the ttl seconds
   */
  public long ttlSeconds() {
    return ttlSeconds;
  }

  /**
   * A freshly issued token.
   *
   * @param token            the signed JWT
   * @param scope            granted scope
   * @param expiresInSeconds lifetime from issuance
   * @param expiresAt        absolute expiry
   */
  public record IssuedToken(String token, String scope, long expiresInSeconds, Instant expiresAt) {
  }

  /**
   * Claims of a verified token.
   *
   * @param clientId  the client the token was issued to
   * @param scope     the granted scope
   * @param issuedAt  issuance time
   * @param expiresAt expiry time
   */
  public record TokenClaims(String clientId, String scope, Instant issuedAt, Instant expiresAt) {
  }
}
