package com.codeheadsystems.glance.server.resource;

import com.codeheadsystems.glance.model.oauth.TokenRequest;
import com.codeheadsystems.glance.model.oauth.TokenResponse;
import com.codeheadsystems.glance.server.auth.CallerAddressResolver;
import com.codeheadsystems.glance.server.exception.OAuthError;
import com.codeheadsystems.glance.server.exception.OAuthException;
import com.codeheadsystems.glance.server.manager.OAuthManager;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OAuth token endpoint.
 * <p>
 * Accepts the standard form-encoded body as well as JSON. Client credentials may be sent in
 * the body or as HTTP Basic; Basic wins when both are present.
 */
@Singleton
@Path("/token")
@Produces(MediaType.APPLICATION_JSON)
public class TokenResource {

  private static final Logger log = LoggerFactory.getLogger(TokenResource.class);
  private static final String BASIC_PREFIX = "Basic ";

  private final OAuthManager oauthManager;
  private final CallerAddressResolver callerAddressResolver;

  /**
   * Instantiates a new Token resource.
   *
   * @param oauthManager          the oauth manager
   * @param callerAddressResolver the caller address resolver
   */
  @Inject
  public TokenResource(final OAuthManager oauthManager,
                       final CallerAddressResolver callerAddressResolver) {
    this.oauthManager = oauthManager;
    this.callerAddressResolver = callerAddressResolver;
    log.info("TokenResource({})", oauthManager);
  }

  /**
   * Token request as {@code application/x-www-form-urlencoded}.
   */
  @POST
  @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
  public Response tokenForm(@FormParam("grant_type") final String grantType,
                            @FormParam("code") final String code,
                            @FormParam("redirect_uri") final String redirectUri,
                            @FormParam("code_verifier") final String codeVerifier,
                            @FormParam("client_id") final String clientId,
                            @FormParam("client_secret") final String clientSecret,
                            @HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization,
                            @Context final HttpServletRequest servletRequest) {
    return exchange(new TokenRequest(grantType, code, redirectUri, codeVerifier, clientId, clientSecret),
        authorization, servletRequest);
  }

  /**
   * Token request as {@code application/json}.
   */
  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  public Response tokenJson(final TokenRequest request,
                            @HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization,
                            @Context final HttpServletRequest servletRequest) {
    if (request == null) {
      throw new OAuthException(OAuthError.INVALID_REQUEST, "Missing request body");
    }
    return exchange(request, authorization, servletRequest);
  }

  private Response exchange(final TokenRequest request,
                            final String authorization,
                            final HttpServletRequest servletRequest) {
    log.trace("exchange(grant_type={})", request.grantType());
    TokenRequest effective = applyBasicCredentials(request, authorization);
    TokenResponse response = oauthManager.exchange(effective, callerAddressResolver.resolve(servletRequest));
    return Response.ok(response)
        .header(HttpHeaders.CACHE_CONTROL, "no-store")
        .header("Pragma", "no-cache")
        .build();
  }

  static TokenRequest applyBasicCredentials(final TokenRequest request, final String authorization) {
    if (authorization == null || !authorization.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
      return request;
    }
    String id;
    String secret;
    try {
      String decoded = new String(Base64.getDecoder().decode(authorization.substring(BASIC_PREFIX.length()).trim()),
          StandardCharsets.UTF_8);
      int colon = decoded.indexOf(':');
      if (colon < 0) {
        throw new OAuthException(OAuthError.INVALID_CLIENT, "Malformed Basic credentials");
      }
      // RFC 6749 2.3.1: both parts are form-urlencoded before being joined
      id = URLDecoder.decode(decoded.substring(0, colon), StandardCharsets.UTF_8);
      secret = URLDecoder.decode(decoded.substring(colon + 1), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new OAuthException(OAuthError.INVALID_CLIENT, "Malformed Basic credentials");
    }
    return request.withClientCredentials(id, secret);
  }
}
