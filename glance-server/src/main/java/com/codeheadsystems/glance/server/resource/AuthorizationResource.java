package com.codeheadsystems.glance.server.resource;

import com.codeheadsystems.glance.server.auth.PkceVerifier;
import com.codeheadsystems.glance.server.manager.AuthorizationRequest;
import com.codeheadsystems.glance.server.manager.OAuthManager;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OAuth authorization endpoint. Auto-approves and redirects straight back with a one-time code.
 */
@Singleton
@Path("/authorize")
public class AuthorizationResource {

  private static final Logger log = LoggerFactory.getLogger(AuthorizationResource.class);

  private final OAuthManager oauthManager;

  /**
   * Instantiates a new Authorization resource.
   *
   * @param oauthManager the oauth manager
   */
  @Inject
  public AuthorizationResource(final OAuthManager oauthManager) {
    this.oauthManager = oauthManager;
    log.info("AuthorizationResource({})", oauthManager);
  }

  /**
   * Issues a code and answers {@code 302 Found} to the client's redirect URI.
   *
   * @param responseType        the response type
   * @param clientId            the client id
   * @param redirectUri         the redirect uri
   * @param state               the state
   * @param codeChallenge       the code challenge
   * @param codeChallengeMethod the code challenge method
   * @return the redirect
   */
  @GET
  @Produces(MediaType.APPLICATION_JSON)
  public Response authorize(@QueryParam("response_type") final String responseType,
                            @QueryParam("client_id") final String clientId,
                            @QueryParam("redirect_uri") final String redirectUri,
                            @QueryParam("state") final String state,
                            @QueryParam("code_challenge") final String codeChallenge,
                            @QueryParam("code_challenge_method") @DefaultValue(PkceVerifier.S256)
                            final String codeChallengeMethod) {
    log.trace("authorize(client_id={})", clientId);
    URI target = oauthManager.authorize(new AuthorizationRequest(
        responseType, clientId, redirectUri, state, codeChallenge, codeChallengeMethod));
    return Response.status(Response.Status.FOUND).location(target).build();
  }
}
