package com.codeheadsystems.glance.dropwizard.auth;

/**
 * What a request to a protected route presents: an optional bearer token and the caller
 * address.
 *
 * @param bearerToken   the token without its {@code Bearer} prefix, or null
 * @param callerAddress the resolved caller address, or null
 */
public record GatewayCredentials(String bearerToken, String callerAddress) {
}
