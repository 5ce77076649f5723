package com.codeheadsystems.glance.model.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token endpoint request. Arrives either as a form body (standard OAuth) or as JSON; both
 * are normalised into this record.
 *
 * @param grantType    {@code authorization_code} or {@code client_credentials}
 * @param code         one-time authorization code (authorization_code grant)
 * @param redirectUri  redirect URI used at authorization time (authorization_code grant)
 * @param codeVerifier PKCE verifier (authorization_code grant)
 * @param clientId     client identifier
 * @param clientSecret client secret (client_credentials grant)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenRequest(
    @JsonProperty("grant_type") String grantType,
    @JsonProperty("code") String code,
    @JsonProperty("redirect_uri") String redirectUri,
    @JsonProperty("code_verifier") String codeVerifier,
    @JsonProperty("client_id") String clientId,
    @JsonProperty("client_secret") String clientSecret) {

  /**
   * Returns a copy carrying the given client credentials, as taken from an HTTP Basic header.
   *
   * @param basicClientId     the client id
   * @param basicClientSecret the client secret
   * @return the token request
   */
  public TokenRequest withClientCredentials(String basicClientId, String basicClientSecret) {
    return new TokenRequest(grantType, code, redirectUri, codeVerifier, basicClientId, basicClientSecret);
  }
}
