package com.codeheadsystems.glance.dropwizard.auth;

import com.codeheadsystems.glance.server.auth.GatewayPrincipal;
import com.codeheadsystems.glance.server.auth.RequestAuthenticator;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that delegates to the {@link RequestAuthenticator}.
 */
public class GatewayAuthenticator implements Authenticator<GatewayCredentials, GatewayPrincipal> {

  private final RequestAuthenticator requestAuthenticator;

  /**
   * Instantiates a new Gateway authenticator.
   *
   * @param requestAuthenticator the request authenticator
   */
  public GatewayAuthenticator(RequestAuthenticator requestAuthenticator) {
    this.requestAuthenticator = requestAuthenticator;
  }

  @Override
  public Optional<GatewayPrincipal> authenticate(GatewayCredentials credentials)
      throws AuthenticationException {
    return requestAuthenticator.authenticate(credentials.bearerToken(), credentials.callerAddress());
  }
}
