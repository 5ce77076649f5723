package com.codeheadsystems.glance.server.exception;

/**
 * Raised by the authorization and token endpoints for any request they refuse. Mapped to an
 * OAuth JSON error body by the framework adapter.
 */
public class OAuthException extends RuntimeException {

  private final OAuthError error;

  /**
   * Instantiates a new OAuth exception.
   *
   * @param error       the error code
   * @param description human-readable description, returned to the client
   */
  public OAuthException(OAuthError error, String description) {
    super(description);
    this.error = error;
  }

  public OAuthError error() {
    return error;
  }

  public String description() {
    return getMessage();
  }
}
