package com.codeheadsystems.glance.server.manager;

import com.codeheadsystems.glance.model.oauth.TokenRequest;
import com.codeheadsystems.glance.model.oauth.TokenResponse;
import com.codeheadsystems.glance.server.auth.AddressFallbackAuthenticator;
import com.codeheadsystems.glance.server.auth.ClientCredentials;
import com.codeheadsystems.glance.server.auth.PkceVerifier;
import com.codeheadsystems.glance.server.auth.TokenManager;
import com.codeheadsystems.glance.server.exception.OAuthError;
import com.codeheadsystems.glance.server.exception.OAuthException;
import com.codeheadsystems.glance.server.store.AuthorizationCode;
import com.codeheadsystems.glance.server.store.AuthorizationCodeStore;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic OAuth logic behind {@code /authorize} and {@code /token}.
 * <p>
 * Supports the authorization-code grant with mandatory PKCE (S256) and the client-credentials
 * grant. Authorization auto-approves: there is no login or consent step, the PKCE binding
 * between the authorize and token calls is the only proof required.
 */
public class OAuthManager {

  public static final String GRANT_AUTHORIZATION_CODE = "authorization_code";
  public static final String GRANT_CLIENT_CREDENTIALS = "client_credentials";
  public static final String RESPONSE_TYPE_CODE = "code";

  private static final Logger log = LoggerFactory.getLogger(OAuthManager.class);
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();
  private static final int CODE_BYTES = 32;

  private final ClientCredentials clientCredentials;
  private final TokenManager tokenManager;
  private final AuthorizationCodeStore authorizationCodeStore;
  private final AddressFallbackAuthenticator addressFallback;
  private final Duration codeTtl;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  public OAuthManager(ClientCredentials clientCredentials,
                      TokenManager tokenManager,
                      AuthorizationCodeStore authorizationCodeStore,
                      AddressFallbackAuthenticator addressFallback,
                      Duration codeTtl,
                      Clock clock) {
    this.clientCredentials = clientCredentials;
    this.tokenManager = tokenManager;
    this.authorizationCodeStore = authorizationCodeStore;
    this.addressFallback = addressFallback;
    this.codeTtl = codeTtl;
    this.clock = clock;
  }

  /**
   * Validates an authorization request, stores a fresh one-time code and returns the redirect
   * target carrying it.
   *
   * @param request the authorization request
   * @return the redirect URI with {@code code} and, when given, {@code state} appended
   * @throws OAuthException if the request is invalid
   */
  public URI authorize(AuthorizationRequest request) {
    if (!RESPONSE_TYPE_CODE.equals(request.responseType())) {
      throw new OAuthException(OAuthError.UNSUPPORTED_RESPONSE_TYPE,
          "Only response_type=code is supported");
    }
    requireParameter(request.clientId(), "client_id");
    requireParameter(request.redirectUri(), "redirect_uri");
    requireParameter(request.codeChallenge(), "code_challenge");
    if (!PkceVerifier.isSupportedMethod(request.codeChallengeMethod())) {
      throw new OAuthException(OAuthError.INVALID_REQUEST,
          "Only code_challenge_method=S256 is supported");
    }
    URI redirect = parseRedirectUri(request.redirectUri());

    String code = newCode();
    authorizationCodeStore.store(new AuthorizationCode(
        code,
        request.clientId(),
        request.codeChallenge(),
        PkceVerifier.S256,
        request.redirectUri(),
        clock.instant().plus(codeTtl)));
    log.info("Issued authorization code for client_id={}", request.clientId());

    StringBuilder target = new StringBuilder(redirect.toString());
    target.append(redirect.getRawQuery() == null ? '?' : '&');
    target.append("code=").append(encode(code));
    if (request.state() != null && !request.state().isEmpty()) {
      target.append("&state=").append(encode(request.state()));
    }
    return URI.create(target.toString());
  }

  /**
   * Handles a token request for either supported grant.
   *
   * @param request       the token request
   * @param callerAddress address of the caller, remembered after a code exchange; may be null
   * @return the token response
   * @throws OAuthException if the request is refused
   */
  public TokenResponse exchange(TokenRequest request, String callerAddress) {
    String grantType = request.grantType();
    if (grantType == null || grantType.isEmpty()) {
      throw new OAuthException(OAuthError.INVALID_REQUEST, "Missing required parameter: grant_type");
    }
    switch (grantType) {
      case GRANT_AUTHORIZATION_CODE:
        return exchangeAuthorizationCode(request, callerAddress);
      case GRANT_CLIENT_CREDENTIALS:
        return exchangeClientCredentials(request);
      default:
        throw new OAuthException(OAuthError.UNSUPPORTED_GRANT_TYPE,
            "Unsupported grant_type: " + grantType);
    }
  }

  private TokenResponse exchangeAuthorizationCode(TokenRequest request, String callerAddress) {
    requireParameter(request.code(), "code");
    requireParameter(request.redirectUri(), "redirect_uri");
    requireParameter(request.codeVerifier(), "code_verifier");

    AuthorizationCode stored = authorizationCodeStore.load(request.code())
        .orElseThrow(() -> invalidGrant("Invalid or expired authorization code"));
    if (!stored.redirectUri().equals(request.redirectUri())) {
      throw invalidGrant("redirect_uri does not match the authorization request");
    }
    if (request.clientId() != null && !request.clientId().isEmpty()
        && !stored.clientId().equals(request.clientId())) {
      throw invalidGrant("client_id does not match the authorization request");
    }
    if (!PkceVerifier.matches(request.codeVerifier(), stored.codeChallenge())) {
      throw invalidGrant("PKCE verification failed");
    }
    if (!authorizationCodeStore.consume(request.code())) {
      // another exchange of the same code won the race
      throw invalidGrant("Invalid or expired authorization code");
    }

    TokenManager.IssuedToken issued = tokenManager.issue(stored.clientId());
    addressFallback.remember(callerAddress, stored.clientId(), issued.expiresAt());
    log.info("Issued access token for client_id={} via authorization_code", stored.clientId());
    return TokenResponse.bearer(issued.token(), issued.expiresInSeconds(), issued.scope());
  }

  private TokenResponse exchangeClientCredentials(TokenRequest request) {
    if (!clientCredentials.isConfigured()) {
      throw new OAuthException(OAuthError.SERVER_ERROR,
          "OAuth client credentials are not configured on this server");
    }
    if (!clientCredentials.matches(request.clientId(), request.clientSecret())) {
      log.warn("Rejected client_credentials request for client_id={}", request.clientId());
      throw new OAuthException(OAuthError.INVALID_CLIENT, "Invalid client credentials");
    }
    TokenManager.IssuedToken issued = tokenManager.issue(request.clientId());
    log.info("Issued access token for client_id={} via client_credentials", request.clientId());
    return TokenResponse.bearer(issued.token(), issued.expiresInSeconds(), issued.scope());
  }

  private String newCode() {
    byte[] bytes = new byte[CODE_BYTES];
    random.nextBytes(bytes);
    return B64URL.encodeToString(bytes);
  }

  private static URI parseRedirectUri(String redirectUri) {
    URI uri;
    try {
      uri = new URI(redirectUri);
    } catch (URISyntaxException e) {
      throw new OAuthException(OAuthError.INVALID_REQUEST, "redirect_uri is not a valid URI");
    }
    String scheme = uri.getScheme();
    if (!uri.isAbsolute() || uri.getHost() == null
        || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
      throw new OAuthException(OAuthError.INVALID_REQUEST,
          "redirect_uri must be an absolute http or https URI");
    }
    if (uri.getRawFragment() != null) {
      throw new OAuthException(OAuthError.INVALID_REQUEST, "redirect_uri must not contain a fragment");
    }
    return uri;
  }

  private static void requireParameter(String value, String name) {
    if (value == null || value.isEmpty()) {
      throw new OAuthException(OAuthError.INVALID_REQUEST, "Missing required parameter: " + name);
    }
  }

  private static OAuthException invalidGrant(String description) {
    log.warn("Rejected authorization_code exchange: {}", description);
    return new OAuthException(OAuthError.INVALID_GRANT, description);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
