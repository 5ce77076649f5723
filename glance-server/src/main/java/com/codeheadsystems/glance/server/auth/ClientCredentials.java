package com.codeheadsystems.glance.server.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * The single statically configured client of this gateway.
 * <p>
 * When either value is empty the gateway runs unsecured: every protected call is accepted
 * under a development identity and the client_credentials grant is disabled.
 *
 * @param clientId     configured client id, may be empty
 * @param clientSecret configured client secret, may be empty
 */
public record ClientCredentials(String clientId, String clientSecret) {

  /**
   * Credentials for an unsecured deployment.
   */
  public static final ClientCredentials NONE = new ClientCredentials("", "");

  /**
   * Normalises nulls to empty strings.
   *
   * @param clientId     the client id
   * @param clientSecret the client secret
   */
  public ClientCredentials {
    clientId = clientId == null ? "" : clientId;
    clientSecret = clientSecret == null ? "" : clientSecret;
  }

  /**
   * Whether the gateway is secured.
   *
   * @return true if both id and secret are configured
   */
  public boolean isConfigured() {
    return !clientId.isEmpty() && !clientSecret.isEmpty();
  }

  /**
   * Constant-time check of a presented id/secret pair.
   *
   * @param presentedId     the presented id, may be null
   * @param presentedSecret the presented secret, may be null
   * @return true only if configured and both values match
   */
  public boolean matches(String presentedId, String presentedSecret) {
    if (!isConfigured() || presentedId == null || presentedSecret == null) {
      return false;
    }
    boolean idMatches = MessageDigest.isEqual(
        clientId.getBytes(StandardCharsets.UTF_8), presentedId.getBytes(StandardCharsets.UTF_8));
    boolean secretMatches = MessageDigest.isEqual(
        clientSecret.getBytes(StandardCharsets.UTF_8), presentedSecret.getBytes(StandardCharsets.UTF_8));
    return idMatches & secretMatches;
  }

  @Override
  public String toString() {
    return "ClientCredentials[clientId=" + clientId + ", clientSecret=***]";
  }
}
