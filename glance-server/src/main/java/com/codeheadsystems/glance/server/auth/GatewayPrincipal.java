package com.codeheadsystems.glance.server.auth;

import java.security.Principal;

/**
 * Principal for an authenticated call to a protected gateway route.
 *
 * @param clientId client identity the call runs under
 * @param method   how the identity was established
 */
public record GatewayPrincipal(String clientId, AuthenticationMethod method) implements Principal {

  /**
   * Identity used for every request when the gateway has no client credentials configured.
   */
  public static final String DEVELOPMENT_CLIENT_ID = "dev-mode";

  @Override
  public String getName() {
    return clientId;
  }

  /**
   * The way a principal was authenticated.
   */
  public enum AuthenticationMethod {
    /** A valid bearer token was presented. */
    BEARER_TOKEN,
    /** The caller address completed an authorization-code exchange recently. */
    CACHED_ADDRESS,
    /** The gateway is unsecured. */
    DEVELOPMENT
  }
}
