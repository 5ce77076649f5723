package com.codeheadsystems.glance.server.exception;

/**
 * OAuth 2.x error codes used by the gateway, with the HTTP status each is answered with.
 */
public enum OAuthError {
  INVALID_REQUEST("invalid_request", 400),
  UNSUPPORTED_RESPONSE_TYPE("unsupported_response_type", 400),
  INVALID_GRANT("invalid_grant", 400),
  INVALID_CLIENT("invalid_client", 401),
  UNSUPPORTED_GRANT_TYPE("unsupported_grant_type", 400),
  SERVER_ERROR("server_error", 400),
  INVALID_TOKEN("invalid_token", 401);

  private final String code;
  private final int status;

  OAuthError(String code, int status) {
    this.code = code;
    this.status = status;
  }

  /**
   * The wire value of the {@code error} field.
   *
   * @return the code
   */
  public String code() {
    return code;
  }

  /**
   * The HTTP status code.
   *
   * @return the status
   */
  public int status() {
    return status;
  }
}
