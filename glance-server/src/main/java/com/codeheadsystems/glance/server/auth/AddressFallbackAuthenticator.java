package com.codeheadsystems.glance.server.auth;

import com.codeheadsystems.glance.server.store.AuthenticatedClient;
import com.codeheadsystems.glance.server.store.AuthenticatedClientStore;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates a request that carries no valid bearer token by its caller address.
 * <p>
 * Some remote agents complete the authorization-code flow and then open further connections
 * that do not present the issued token. An address that completed an exchange is remembered
 * until the token it received would have expired, and requests from that address are accepted
 * under the same client id.
 * <p>
 * This weakens authentication to "anyone sharing the caller's address", which includes every
 * client behind the same NAT or proxy. It is therefore a separate component, logged at INFO on
 * every use, and switched off entirely with {@code addressFallbackEnabled: false}.
 */
public class AddressFallbackAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(AddressFallbackAuthenticator.class);

  private final AuthenticatedClientStore authenticatedClientStore;
  private final boolean enabled;

  public AddressFallbackAuthenticator(AuthenticatedClientStore authenticatedClientStore,
                                      boolean enabled) {
    this.authenticatedClientStore = authenticatedClientStore;
    this.enabled = enabled;
  }

  /**
   * Records that an address completed an authorization-code exchange. Does nothing when the
   * fallback is disabled or the address is unknown.
   *
   * @param callerAddress the caller address, may be null
   * @param clientId      the authenticated client id
   * @param expiresAt     expiry of the token issued in the exchange
   */
  public void remember(String callerAddress, String clientId, Instant expiresAt) {
    if (!enabled || callerAddress == null || callerAddress.isEmpty()) {
      return;
    }
    authenticatedClientStore.store(new AuthenticatedClient(callerAddress, clientId, expiresAt));
  }

  /**
   * Looks up an unexpired entry for the address.
   *
   * @param callerAddress the caller address, may be null
   * @return the principal if the address is cached and the fallback is enabled
   */
  public Optional<GatewayPrincipal> authenticate(String callerAddress) {
    if (!enabled || callerAddress == null) {
      return Optional.empty();
    }
    Optional<GatewayPrincipal> principal = authenticatedClientStore.load(callerAddress)
        .map(entry -> new GatewayPrincipal(entry.clientId(),
            GatewayPrincipal.AuthenticationMethod.CACHED_ADDRESS));
    principal.ifPresent(p -> log.info("Authenticated {} by cached address as client_id={}",
        callerAddress, p.clientId()));
    return principal;
  }

  public boolean isEnabled() {
    return enabled;
  }
}
