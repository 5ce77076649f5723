package com.codeheadsystems.glance.model.oauth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful token endpoint response (RFC 6749 §5.1).
 * <p>
 * Used by: {@code POST /token} response
 *
 * @param accessToken      signed bearer token
 * @param tokenType        always {@code Bearer}
 * @param expiresInSeconds lifetime of the token in seconds from issuance
 * @param scope            granted scope
 */
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") long expiresInSeconds,
    @JsonProperty("scope") String scope) {

  /**
   * Bearer token response.
   *
   * @param accessToken      the access token
   * @param expiresInSeconds the expires in seconds
   * @param scope            the scope
   * @return the token response
   */
  public static TokenResponse bearer(String accessToken, long expiresInSeconds, String scope) {
    return new TokenResponse(accessToken, "Bearer", expiresInSeconds, scope);
  }
}
