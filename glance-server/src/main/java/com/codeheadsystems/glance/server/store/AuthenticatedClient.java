package com.codeheadsystems.glance.server.store;

import java.time.Instant;

/**
 * A caller address that recently completed an authorization-code exchange.
 *
 * @param callerAddress the network address of the caller
 * @param clientId      client identity the exchange authenticated
 * @param expiresAt     same expiry as the token issued in that exchange
 */
public record AuthenticatedClient(String callerAddress, String clientId, Instant expiresAt)
    implements Expiring {
}
