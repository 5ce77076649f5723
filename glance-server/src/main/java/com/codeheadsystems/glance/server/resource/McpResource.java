package com.codeheadsystems.glance.server.resource;

import com.codeheadsystems.glance.server.auth.RequestAuthenticator;
import com.codeheadsystems.glance.server.mcp.McpServerInfo;
import com.codeheadsystems.glance.server.tool.GlanceToolCatalog;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Open routes of the MCP endpoint: discovery, health and session teardown, so agents can find
 * out how to authenticate.
 * <p>
 * {@code POST /mcp} never reaches this resource. It is answered by the MCP server's servlet
 * transport behind the authentication filter.
 */
@Singleton
@Path("/mcp")
@Produces(MediaType.APPLICATION_JSON)
public class McpResource {

  private static final Logger log = LoggerFactory.getLogger(McpResource.class);

  private final McpServerInfo serverInfo;
  private final RequestAuthenticator requestAuthenticator;

  /**
   * Instantiates a new Mcp resource.
   *
   * @param serverInfo           identity reported in discovery and health
   * @param requestAuthenticator reports whether authentication is enabled
   */
  @Inject
  public McpResource(final McpServerInfo serverInfo,
                     final RequestAuthenticator requestAuthenticator) {
    this.serverInfo = serverInfo;
    this.requestAuthenticator = requestAuthenticator;
    log.info("McpResource({})", serverInfo);
  }

  /**
   * Discovery document.
   */
  @GET
  public Map<String, Object> discovery(@HeaderParam(RequestBaseUrl.FORWARDED_PROTO) final String forwardedProto,
                                       @HeaderParam(RequestBaseUrl.FORWARDED_HOST) final String forwardedHost,
                                       @Context final UriInfo uriInfo) {
    String baseUrl = RequestBaseUrl.resolve(forwardedProto, forwardedHost, uriInfo.getBaseUri());
    boolean secured = requestAuthenticator.isSecured();

    Map<String, Object> authentication = new LinkedHashMap<>();
    authentication.put("type", secured ? "oauth2" : "none");
    authentication.put("tokenEndpoint", baseUrl + "/token");
    authentication.put("authorizationEndpoint", baseUrl + "/authorize");
    authentication.put("required", secured);

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("name", serverInfo.name());
    document.put("version", serverInfo.version());
    document.put("description", serverInfo.description());
    document.put("authentication", authentication);
    document.put("transport", "streamable-http");
    document.put("stateless", true);
    document.put("endpoint", baseUrl + "/mcp");
    return document;
  }

  /**
   * Session teardown. There are no sessions, so this always succeeds.
   */
  @DELETE
  public Response terminate() {
    return Response.noContent().build();
  }

  @GET
  @Path("/health")
  public Map<String, Object> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", "healthy");
    health.put("server", serverInfo.name());
    health.put("version", serverInfo.version());
    health.put("authentication", requestAuthenticator.isSecured() ? "oauth2" : "disabled");
    health.put("tools", GlanceToolCatalog.TOOL_NAMES);
    return health;
  }
}
