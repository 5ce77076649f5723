package com.codeheadsystems.glance.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for the Glance gateway.
 * <p>
 * For production, supply {@code mcpClientId}, {@code mcpClientSecret} and {@code jwtSecretHex}.
 * Omitting the client credentials disables authentication entirely (development mode).
 * Omitting the JWT secret causes a random one to be generated on each startup, so issued
 * tokens do not survive a restart.
 */
public class GlanceGatewayConfiguration extends Configuration {
  /**
   * OAuth client id accepted at {@code /token}.
   * Leave empty (or leave the secret empty) to run in development mode, where every
   * request to {@code /mcp} is accepted without credentials.
   */
  private String mcpClientId = "";

  /**
   * OAuth client secret paired with {@link #mcpClientId}.
   */
  private String mcpClientSecret = "";

  /**
   * Hex-encoded HMAC-SHA256 signing secret for access tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   * Generate one with: {@code openssl rand -hex 32}
   */
  private String jwtSecretHex = "";

  /**
   * Access token time-to-live in seconds.
   */
  @Min(1)
  private long jwtTtlSeconds = 3600;

  /**
   * Access token issuer claim.
   */
  @NotEmpty
  private String jwtIssuer = "glance-art-guide";

  /**
   * Authorization code time-to-live in seconds.
   */
  @Min(1)
  private long authorizationCodeTtlSeconds = 600;

  /**
   * Maximum number of outstanding authorization codes. The oldest are evicted first.
   */
  @Min(1)
  private int maxAuthorizationCodes = 1000;

  /**
   * Maximum number of caller addresses remembered for the address fallback.
   */
  @Min(1)
  private int maxAuthenticatedClients = 100;

  /**
   * Seconds between expiry sweeps of the code store and the address cache.
   */
  @Min(1)
  private long sweepIntervalSeconds = 60;

  /**
   * Accept token-less {@code /mcp} calls from an address that recently completed the
   * authorization code flow. Some agent connectors drop the bearer token after the flow;
   * turn this off when every client sends its token.
   */
  private boolean addressFallbackEnabled = true;

  /**
   * Use the first {@code X-Forwarded-For} hop as the caller address.
   * Only enable this behind a proxy that overwrites the header.
   */
  private boolean trustForwardedFor = false;

  /**
   * Base URL of the Glance display server.
   */
  @NotEmpty
  private String glanceBaseUrl = "http://localhost:3000";

  /**
   * Timeout in seconds for each call to the Glance display server.
   */
  @Min(1)
  private long backendTimeoutSeconds = 30;

  /**
   * Gets mcp client id.
   *
   * @return the mcp client id
   */
  @JsonProperty
  public String getMcpClientId() {
    return mcpClientId;
  }

  /**
   * Sets mcp client id.
   *
   * @param mcpClientId the mcp client id
   */
  @JsonProperty
  public void setMcpClientId(String mcpClientId) {
    this.mcpClientId = mcpClientId;
  }

  /**
   * Gets mcp client secret.
   *
   * @return the mcp client secret
   */
  @JsonProperty
  public String getMcpClientSecret() {
    return mcpClientSecret;
  }

  /**
   * Sets mcp client secret.
   *
   * @param mcpClientSecret the mcp client secret
   */
  @JsonProperty
  public void setMcpClientSecret(String mcpClientSecret) {
    this.mcpClientSecret = mcpClientSecret;
  }

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  /**
   * Sets jwt secret hex.
   *
   * @param jwtSecretHex the jwt secret hex
   */
  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  /**
   * Gets jwt ttl seconds.
   *
   * @return the jwt ttl seconds
   */
  @JsonProperty
  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  /**
   * Sets jwt ttl seconds.
   *
   * @param jwtTtlSeconds the jwt ttl seconds
   */
  @JsonProperty
  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  /**
   * Gets authorization code ttl seconds.
   *
   * @return the authorization code ttl seconds
   */
  @JsonProperty
  public long getAuthorizationCodeTtlSeconds() {
    return authorizationCodeTtlSeconds;
  }

  /**
   * Sets authorization code ttl seconds.
   *
   * @param authorizationCodeTtlSeconds the authorization code ttl seconds
   */
  @JsonProperty
  public void setAuthorizationCodeTtlSeconds(long authorizationCodeTtlSeconds) {
    this.authorizationCodeTtlSeconds = authorizationCodeTtlSeconds;
  }

  /**
   * Gets max authorization codes.
   *
   * @return the max authorization codes
   */
  @JsonProperty
  public int getMaxAuthorizationCodes() {
    return maxAuthorizationCodes;
  }

  /**
   * Sets max authorization codes.
   *
   * @param maxAuthorizationCodes the max authorization codes
   */
  @JsonProperty
  public void setMaxAuthorizationCodes(int maxAuthorizationCodes) {
    this.maxAuthorizationCodes = maxAuthorizationCodes;
  }

  /**
   * Gets max authenticated clients.
   *
   * @return the max authenticated clients
   */
  @JsonProperty
  public int getMaxAuthenticatedClients() {
    return maxAuthenticatedClients;
  }

  /**
   * Sets max authenticated clients.
   *
   * @param maxAuthenticatedClients the max authenticated clients
   */
  @JsonProperty
  public void setMaxAuthenticatedClients(int maxAuthenticatedClients) {
    this.maxAuthenticatedClients = maxAuthenticatedClients;
  }

  /**
   * Gets sweep interval seconds.
   *
   * @return the sweep interval seconds
   */
  @JsonProperty
  public long getSweepIntervalSeconds() {
    return sweepIntervalSeconds;
  }

  /**
   * Sets sweep interval seconds.
   *
   * @param sweepIntervalSeconds the sweep interval seconds
   */
  @JsonProperty
  public void setSweepIntervalSeconds(long sweepIntervalSeconds) {
    this.sweepIntervalSeconds = sweepIntervalSeconds;
  }

  /**
   * Gets address fallback enabled.
   *
   * @return the address fallback enabled
   */
  @JsonProperty
  public boolean isAddressFallbackEnabled() {
    return addressFallbackEnabled;
  }

  /**
   * Sets address fallback enabled.
   *
   * @param addressFallbackEnabled the address fallback enabled
   */
  @JsonProperty
  public void setAddressFallbackEnabled(boolean addressFallbackEnabled) {
    this.addressFallbackEnabled = addressFallbackEnabled;
  }

  /**
   * Gets trust forwarded for.
   *
   * @return the trust forwarded for
   */
  @JsonProperty
  public boolean isTrustForwardedFor() {
    return trustForwardedFor;
  }

  /**
   * Sets trust forwarded for.
   *
   * @param trustForwardedFor the trust forwarded for
   */
  @JsonProperty
  public void setTrustForwardedFor(boolean trustForwardedFor) {
    this.trustForwardedFor = trustForwardedFor;
  }

  /**
   * Gets glance base url.
   *
   * @return the glance base url
   */
  @JsonProperty
  public String getGlanceBaseUrl() {
    return glanceBaseUrl;
  }

  /**
   * Sets glance base url.
   *
   * @param glanceBaseUrl the glance base url
   */
  @JsonProperty
  public void setGlanceBaseUrl(String glanceBaseUrl) {
    this.glanceBaseUrl = glanceBaseUrl;
  }

  /**
   * Gets backend timeout seconds.
   *
   * @return the backend timeout seconds
   */
  @JsonProperty
  public long getBackendTimeoutSeconds() {
    return backendTimeoutSeconds;
  }

  /**
   * Sets backend timeout seconds.
   *
   * @param backendTimeoutSeconds the backend timeout seconds
   */
  @JsonProperty
  public void setBackendTimeoutSeconds(long backendTimeoutSeconds) {
    this.backendTimeoutSeconds = backendTimeoutSeconds;
  }
}
