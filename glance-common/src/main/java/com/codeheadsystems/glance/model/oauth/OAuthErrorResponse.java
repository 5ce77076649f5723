package com.codeheadsystems.glance.model.oauth;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OAuth error body (RFC 6749 §5.2), also used for {@code invalid_token} rejections on
 * protected routes.
 *
 * @param error            machine-readable error code, e.g. {@code invalid_grant}
 * @param errorDescription human-readable explanation
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OAuthErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("error_description") String errorDescription) {
}
