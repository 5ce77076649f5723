package com.codeheadsystems.glance.server.store;

import java.time.Instant;

/**
 * A one-time authorization code awaiting exchange at the token endpoint.
 *
 * @param code                the code value handed to the client
 * @param clientId            client the code was issued to
 * @param codeChallenge       PKCE challenge presented at authorization time
 * @param codeChallengeMethod PKCE method, always {@code S256}
 * @param redirectUri         redirect URI the exchange must repeat exactly
 * @param expiresAt           when the code stops being exchangeable
 */
public record AuthorizationCode(
    String code,
    String clientId,
    String codeChallenge,
    String codeChallengeMethod,
    String redirectUri,
    Instant expiresAt) implements Expiring {
}
