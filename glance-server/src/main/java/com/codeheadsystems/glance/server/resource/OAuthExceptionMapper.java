package com.codeheadsystems.glance.server.resource;

import com.codeheadsystems.glance.model.oauth.OAuthErrorResponse;
import com.codeheadsystems.glance.server.exception.OAuthError;
import com.codeheadsystems.glance.server.exception.OAuthException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Renders {@link OAuthException} as the OAuth JSON error body.
 */
@Provider
public class OAuthExceptionMapper implements ExceptionMapper<OAuthException> {

  @Override
  public Response toResponse(OAuthException exception) {
    Response.ResponseBuilder builder = Response.status(exception.error().status())
        .type(MediaType.APPLICATION_JSON_TYPE)
        .header(HttpHeaders.CACHE_CONTROL, "no-store")
        .entity(new OAuthErrorResponse(exception.error().code(), exception.description()));
    if (exception.error() == OAuthError.INVALID_CLIENT) {
      builder.header(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"glance\"");
    }
    return builder.build();
  }
}
