package com.codeheadsystems.glance.server.resource;

import com.codeheadsystems.glance.server.auth.PkceVerifier;
import com.codeheadsystems.glance.server.auth.TokenManager;
import com.codeheadsystems.glance.server.manager.OAuthManager;
import jakarta.inject.Singleton;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OAuth discovery documents: authorization server metadata (RFC 8414) and protected resource
 * metadata (RFC 9728).
 */
@Singleton
@Path("/.well-known")
@Produces(MediaType.APPLICATION_JSON)
public class WellKnownResource {

  @GET
  @Path("/oauth-authorization-server")
  public Map<String, Object> authorizationServer(
      @HeaderParam(RequestBaseUrl.FORWARDED_PROTO) final String forwardedProto,
      @HeaderParam(RequestBaseUrl.FORWARDED_HOST) final String forwardedHost,
      @Context final UriInfo uriInfo) {
    String baseUrl = RequestBaseUrl.resolve(forwardedProto, forwardedHost, uriInfo.getBaseUri());
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("issuer", baseUrl);
    metadata.put("authorization_endpoint", baseUrl + "/authorize");
    metadata.put("token_endpoint", baseUrl + "/token");
    metadata.put("token_endpoint_auth_methods_supported",
        List.of("none", "client_secret_post", "client_secret_basic"));
    metadata.put("grant_types_supported",
        List.of(OAuthManager.GRANT_AUTHORIZATION_CODE, OAuthManager.GRANT_CLIENT_CREDENTIALS));
    metadata.put("response_types_supported", List.of(OAuthManager.RESPONSE_TYPE_CODE));
    metadata.put("code_challenge_methods_supported", List.of(PkceVerifier.S256));
    metadata.put("scopes_supported", List.of(TokenManager.SCOPE));
    metadata.put("service_documentation", baseUrl + "/mcp");
    return metadata;
  }

  @GET
  @Path("/oauth-protected-resource")
  public Map<String, Object> protectedResource(
      @HeaderParam(RequestBaseUrl.FORWARDED_PROTO) final String forwardedProto,
      @HeaderParam(RequestBaseUrl.FORWARDED_HOST) final String forwardedHost,
      @Context final UriInfo uriInfo) {
    String baseUrl = RequestBaseUrl.resolve(forwardedProto, forwardedHost, uriInfo.getBaseUri());
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("resource", baseUrl + "/mcp");
    metadata.put("authorization_servers", List.of(baseUrl));
    metadata.put("bearer_methods_supported", List.of("header"));
    metadata.put("scopes_supported", List.of(TokenManager.SCOPE));
    return metadata;
  }

  /**
   * Path-suffixed variant that agents derive from the resource URL, e.g.
   * {@code /.well-known/oauth-protected-resource/mcp}. There is only one protected resource, so
   * every suffix answers the same document.
   */
  @GET
  @Path("/oauth-protected-resource/{resourcePath: .+}")
  public Map<String, Object> protectedResourceForPath(
      @HeaderParam(RequestBaseUrl.FORWARDED_PROTO) final String forwardedProto,
      @HeaderParam(RequestBaseUrl.FORWARDED_HOST) final String forwardedHost,
      @Context final UriInfo uriInfo) {
    return protectedResource(forwardedProto, forwardedHost, uriInfo);
  }
}
