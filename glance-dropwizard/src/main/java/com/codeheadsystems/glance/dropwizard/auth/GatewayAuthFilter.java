package com.codeheadsystems.glance.dropwizard.auth;

import com.codeheadsystems.glance.model.oauth.OAuthErrorResponse;
import com.codeheadsystems.glance.server.auth.CallerAddressResolver;
import com.codeheadsystems.glance.server.auth.GatewayPrincipal;
import com.codeheadsystems.glance.server.exception.OAuthError;
import com.codeheadsystems.glance.server.resource.RequestBaseUrl;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.URI;
import java.security.Principal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Servlet filter guarding {@code POST /mcp}, the route served by the MCP transport servlet.
 * <p>
 * It always calls the authenticator, even without an {@code Authorization} header, so
 * development mode and the address fallback can accept the request. Rejections carry an OAuth
 * {@code invalid_token} body and a {@code WWW-Authenticate} challenge pointing at the
 * protected-resource metadata. Other methods pass through untouched.
 */
public class GatewayAuthFilter implements Filter {

  static final String BEARER = "Bearer";

  private static final Logger log = LoggerFactory.getLogger(GatewayAuthFilter.class);

  private final Authenticator<GatewayCredentials, GatewayPrincipal> authenticator;
  private final CallerAddressResolver callerAddressResolver;
  private final ObjectMapper objectMapper;
  private final String realm;

  /**
   * Instantiates a new Gateway auth filter.
   *
   * @param authenticator         decides whether the credentials are acceptable
   * @param callerAddressResolver finds the caller address for the address fallback
   * @param objectMapper          writes the error body
   * @param realm                 realm named in the challenge
   */
  public GatewayAuthFilter(Authenticator<GatewayCredentials, GatewayPrincipal> authenticator,
                           CallerAddressResolver callerAddressResolver,
                           ObjectMapper objectMapper,
                           String realm) {
    this.authenticator = authenticator;
    this.callerAddressResolver = callerAddressResolver;
    this.objectMapper = objectMapper;
    this.realm = realm;
  }

  @Override
  public void doFilter(ServletRequest servletRequest, ServletResponse servletResponse, FilterChain chain)
      throws IOException, ServletException {
    HttpServletRequest request = (HttpServletRequest) servletRequest;
    if (!"POST".equalsIgnoreCase(request.getMethod())) {
      chain.doFilter(servletRequest, servletResponse);
      return;
    }
    String token = bearerToken(request.getHeader("Authorization"));
    GatewayCredentials credentials = new GatewayCredentials(token, callerAddressResolver.resolve(request));
    Optional<GatewayPrincipal> principal;
    try {
      principal = authenticator.authenticate(credentials);
    } catch (AuthenticationException e) {
      throw new ServletException("Unable to authenticate MCP request", e);
    }
    if (principal.isEmpty()) {
      log.debug("Rejected MCP request from {} (token present: {})", credentials.callerAddress(), token != null);
      unauthorized(request, (HttpServletResponse) servletResponse, token == null);
      return;
    }
    log.trace("doFilter(principal={})", principal.get().getName());
    chain.doFilter(new AuthenticatedRequest(request, principal.get()), servletResponse);
  }

  /**
   * Extracts the token from an {@code Authorization} header value.
   *
   * @param header the header value, may be null
   * @return the token, or null when the header is absent or not a bearer credential
   */
  static String bearerToken(String header) {
    if (header == null) {
      return null;
    }
    int space = header.indexOf(' ');
    if (space <= 0 || !BEARER.equalsIgnoreCase(header.substring(0, space))) {
      return null;
    }
    String token = header.substring(space + 1).trim();
    return token.isEmpty() ? null : token;
  }

  /**
   * Base URI the request was received on, with the context path and a trailing slash.
   *
   * @param request the request
   * @return the base URI
   */
  static URI requestBaseUri(HttpServletRequest request) {
    String url = request.getRequestURL().toString();
    String origin = url.substring(0, url.length() - request.getRequestURI().length());
    return URI.create(origin + request.getContextPath() + "/");
  }

  private void unauthorized(HttpServletRequest request, HttpServletResponse response, boolean missingToken)
      throws IOException {
    String baseUrl = RequestBaseUrl.resolve(
        request.getHeader(RequestBaseUrl.FORWARDED_PROTO),
        request.getHeader(RequestBaseUrl.FORWARDED_HOST),
        requestBaseUri(request));
    String description = missingToken
        ? "Missing bearer token"
        : "Invalid or expired bearer token";
    String challenge = String.format(
        "%s realm=\"%s\", error=\"%s\", resource_metadata=\"%s/.well-known/oauth-protected-resource\"",
        BEARER, realm, OAuthError.INVALID_TOKEN.code(), baseUrl);
    response.setStatus(OAuthError.INVALID_TOKEN.status());
    response.setHeader("WWW-Authenticate", challenge);
    response.setContentType("application/json");
    response.setCharacterEncoding("UTF-8");
    objectMapper.writeValue(response.getOutputStream(),
        new OAuthErrorResponse(OAuthError.INVALID_TOKEN.code(), description));
  }

  /**
   * Exposes the authenticated principal to whatever handles the request next.
   */
  private static class AuthenticatedRequest extends HttpServletRequestWrapper {

    private final GatewayPrincipal principal;

    AuthenticatedRequest(HttpServletRequest request, GatewayPrincipal principal) {
      super(request);
      this.principal = principal;
    }

    @Override
    public Principal getUserPrincipal() {
      return principal;
    }

    @Override
    public String getAuthType() {
      return BEARER;
    }
  }
}
