package com.codeheadsystems.glance.server.manager;

/**
 * Query parameters of {@code GET /authorize}.
 *
 * @param responseType        must be {@code code}
 * @param clientId            requesting client
 * @param redirectUri         absolute http(s) URI the code is delivered to
 * @param state               opaque value echoed back on the redirect, may be null
 * @param codeChallenge       PKCE challenge
 * @param codeChallengeMethod PKCE method, null defaults to {@code S256}
 */
public record AuthorizationRequest(
    String responseType,
    String clientId,
    String redirectUri,
    String state,
    String codeChallenge,
    String codeChallengeMethod) {
}
