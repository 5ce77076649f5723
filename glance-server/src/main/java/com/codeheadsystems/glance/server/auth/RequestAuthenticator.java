package com.codeheadsystems.glance.server.auth;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a call to a protected route is authenticated.
 * <p>
 * Order of checks:
 * <ol>
 *   <li>No client credentials configured: the call runs as {@code dev-mode}.</li>
 *   <li>A bearer token that the {@link TokenManager} verifies.</li>
 *   <li>The {@link AddressFallbackAuthenticator}, when enabled.</li>
 * </ol>
 * Framework adapters turn an empty result into a 401 {@code invalid_token} response.
 */
public class RequestAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(RequestAuthenticator.class);

  private final ClientCredentials clientCredentials;
  private final TokenManager tokenManager;
  private final AddressFallbackAuthenticator addressFallback;

  public RequestAuthenticator(ClientCredentials clientCredentials,
                              TokenManager tokenManager,
                              AddressFallbackAuthenticator addressFallback) {
    this.clientCredentials = clientCredentials;
    this.tokenManager = tokenManager;
    this.addressFallback = addressFallback;
  }

  /**
   * Authenticates a call.
   *
   * @param bearerToken   the bearer token without its scheme prefix, may be null
   * @param callerAddress the resolved caller address, may be null
   * @return the principal, or empty if the call must be rejected
   */
  public Optional<GatewayPrincipal> authenticate(String bearerToken, String callerAddress) {
    if (!clientCredentials.isConfigured()) {
      return Optional.of(new GatewayPrincipal(GatewayPrincipal.DEVELOPMENT_CLIENT_ID,
          GatewayPrincipal.AuthenticationMethod.DEVELOPMENT));
    }
    if (bearerToken != null) {
      Optional<GatewayPrincipal> fromToken = tokenManager.verify(bearerToken)
          .map(claims -> new GatewayPrincipal(claims.clientId(),
              GatewayPrincipal.AuthenticationMethod.BEARER_TOKEN));
      if (fromToken.isPresent()) {
        return fromToken;
      }
      log.warn("Rejected bearer token from {}", callerAddress);
    }
    Optional<GatewayPrincipal> fromAddress = addressFallback.authenticate(callerAddress);
    if (fromAddress.isEmpty()) {
      log.debug("No credentials accepted for request from {}", callerAddress);
    }
    return fromAddress;
  }

  /**
   * Whether the gateway requires authentication at all.
   *
   * @return false in development mode
   */
  public boolean isSecured() {
    return clientCredentials.isConfigured();
  }
}
