package com.codeheadsystems.glance.dropwizard;

import com.codeheadsystems.glance.dropwizard.auth.GatewayAuthFilter;
import com.codeheadsystems.glance.dropwizard.auth.GatewayAuthenticator;
import com.codeheadsystems.glance.dropwizard.health.TokenCodecHealthCheck;
import com.codeheadsystems.glance.dropwizard.lifecycle.ExpirySweeperManager;
import com.codeheadsystems.glance.dropwizard.lifecycle.McpServerManager;
import com.codeheadsystems.glance.dropwizard.mcp.McpTransportFilter;
import com.codeheadsystems.glance.server.accessor.GlanceAccessor;
import com.codeheadsystems.glance.server.auth.AddressFallbackAuthenticator;
import com.codeheadsystems.glance.server.auth.CallerAddressResolver;
import com.codeheadsystems.glance.server.auth.ClientCredentials;
import com.codeheadsystems.glance.server.auth.RequestAuthenticator;
import com.codeheadsystems.glance.server.auth.TokenManager;
import com.codeheadsystems.glance.server.bridge.InMemoryResultBridge;
import com.codeheadsystems.glance.server.bridge.ResultBridge;
import com.codeheadsystems.glance.server.manager.OAuthManager;
import com.codeheadsystems.glance.server.mcp.McpServerFactory;
import com.codeheadsystems.glance.server.mcp.McpServerInfo;
import com.codeheadsystems.glance.server.resource.AiSearchResource;
import com.codeheadsystems.glance.server.resource.AuthorizationResource;
import com.codeheadsystems.glance.server.resource.McpResource;
import com.codeheadsystems.glance.server.resource.OAuthExceptionMapper;
import com.codeheadsystems.glance.server.resource.TokenResource;
import com.codeheadsystems.glance.server.resource.WellKnownResource;
import com.codeheadsystems.glance.server.store.AuthenticatedClientStore;
import com.codeheadsystems.glance.server.store.AuthorizationCodeStore;
import com.codeheadsystems.glance.server.store.ExpirySweeper;
import com.codeheadsystems.glance.server.store.InMemoryAuthenticatedClientStore;
import com.codeheadsystems.glance.server.store.InMemoryAuthorizationCodeStore;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.server.McpStatelessSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStatelessServerTransport;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.servlet.DispatcherType;
import java.net.URI;
import java.net.http.HttpClient;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the Glance gateway into an existing Dropwizard application.
 * <p>
 * Registers the OAuth, MCP discovery, result bridge and well-known resources, the OAuth
 * exception mapper, the stateless MCP server on {@code POST /mcp} behind the bearer/address
 * authentication filter, the {@code token-codec} health check and the expiry sweeper.
 * Requires a {@link GlanceGatewayConfiguration} block in the application's YAML config.
 * <p>
 * Embed in your application with in-memory stores:
 * <pre>{@code
 *   bootstrap.addBundle(new GlanceBundle<>());
 * }</pre>
 * <p>
 * Or supply shared stores, for example when several gateway instances sit behind one load
 * balancer:
 * <pre>{@code
 *   bootstrap.addBundle(new GlanceBundle<>(codeStore, clientStore, resultBridge));
 * }</pre>
 */
@Singleton
public class GlanceBundle<C extends GlanceGatewayConfiguration> implements ConfiguredBundle<C> {

  static final String REALM = "glance";
  static final String MCP_ENDPOINT = "/mcp";

  private static final Logger log = LoggerFactory.getLogger(GlanceBundle.class);

  private final AuthorizationCodeStore authorizationCodeStore;
  private final AuthenticatedClientStore authenticatedClientStore;
  private final ResultBridge resultBridge;

  /**
   * Creates a bundle whose stores are sized from the configuration and live in this JVM only.
   * Outstanding codes, remembered addresses and the latest search are lost on restart.
   */
  public GlanceBundle() {
    this(null, null, null);
    log.info("Using in-memory authorization code, address and result stores");
  }

  /**
   * Creates a bundle backed by the supplied stores. A null store is replaced with an in-memory
   * one sized from the configuration.
   *
   * @param authorizationCodeStore   holds outstanding authorization codes
   * @param authenticatedClientStore holds addresses for the address fallback
   * @param resultBridge             holds the latest search for the web page
   */
  @Inject
  public GlanceBundle(AuthorizationCodeStore authorizationCodeStore,
                      AuthenticatedClientStore authenticatedClientStore,
                      ResultBridge resultBridge) {
    this.authorizationCodeStore = authorizationCodeStore;
    this.authenticatedClientStore = authenticatedClientStore;
    this.resultBridge = resultBridge != null ? resultBridge : new InMemoryResultBridge();
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    AuthorizationCodeStore codeStore = authorizationCodeStore != null
        ? authorizationCodeStore
        : new InMemoryAuthorizationCodeStore(configuration.getMaxAuthorizationCodes(), Clock.systemUTC());
    AuthenticatedClientStore clientStore = authenticatedClientStore != null
        ? authenticatedClientStore
        : new InMemoryAuthenticatedClientStore(configuration.getMaxAuthenticatedClients(), Clock.systemUTC());

    TokenManager tokenManager = buildTokenManager(configuration);
    ClientCredentials clientCredentials = buildClientCredentials(configuration);
    AddressFallbackAuthenticator addressFallback =
        new AddressFallbackAuthenticator(clientStore, configuration.isAddressFallbackEnabled());
    RequestAuthenticator requestAuthenticator =
        new RequestAuthenticator(clientCredentials, tokenManager, addressFallback);
    OAuthManager oauthManager = new OAuthManager(clientCredentials, tokenManager, codeStore,
        addressFallback, Duration.ofSeconds(configuration.getAuthorizationCodeTtlSeconds()),
        Clock.systemUTC());
    CallerAddressResolver callerAddressResolver =
        new CallerAddressResolver(configuration.isTrustForwardedFor());
    McpServerFactory mcpServerFactory = new McpServerFactory(
        buildGlanceAccessor(configuration, environment), resultBridge, McpServerInfo.GLANCE);
    HttpServletStatelessServerTransport mcpTransport = HttpServletStatelessServerTransport.builder()
        .jsonMapper(McpJsonMapper.getDefault())
        .messageEndpoint(MCP_ENDPOINT)
        .build();
    McpStatelessSyncServer mcpServer = mcpServerFactory.create(mcpTransport);

    environment.jersey().register(new OAuthExceptionMapper());
    environment.jersey().register(new AuthorizationResource(oauthManager));
    environment.jersey().register(new TokenResource(oauthManager, callerAddressResolver));
    environment.jersey().register(new McpResource(mcpServerFactory.serverInfo(), requestAuthenticator));
    environment.jersey().register(new AiSearchResource(resultBridge));
    environment.jersey().register(new WellKnownResource());

    // Bearer token, development mode or cached address, then the MCP transport, for POST /mcp
    environment.servlets()
        .addFilter("mcp-auth", new GatewayAuthFilter(new GatewayAuthenticator(requestAuthenticator),
            callerAddressResolver, environment.getObjectMapper(), REALM))
        .addMappingForUrlPatterns(EnumSet.of(DispatcherType.REQUEST), true, MCP_ENDPOINT);
    environment.servlets()
        .addFilter("mcp-transport", new McpTransportFilter(mcpTransport))
        .addMappingForUrlPatterns(EnumSet.of(DispatcherType.REQUEST), true, MCP_ENDPOINT);

    environment.healthChecks().register("token-codec", new TokenCodecHealthCheck(tokenManager));
    environment.lifecycle().manage(new ExpirySweeperManager(new ExpirySweeper(codeStore, clientStore,
        Duration.ofSeconds(configuration.getSweepIntervalSeconds()))));
    environment.lifecycle().manage(new McpServerManager(mcpServer));
  }

  private TokenManager buildTokenManager(C configuration) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new TokenManager(secret, configuration.getJwtIssuer(), configuration.getJwtTtlSeconds());
  }

  private ClientCredentials buildClientCredentials(C configuration) {
    ClientCredentials credentials =
        new ClientCredentials(configuration.getMcpClientId(), configuration.getMcpClientSecret());
    if (!credentials.isConfigured()) {
      log.warn("""
          #################################################################
          # WARNING: No MCP client credentials configured. Every request  #
          # to /mcp is accepted without authentication.                   #
          # Set mcpClientId and mcpClientSecret before exposing this.     #
          #################################################################
          """);
    }
    return credentials;
  }

  private GlanceAccessor buildGlanceAccessor(C configuration, Environment environment) {
    Duration timeout = Duration.ofSeconds(configuration.getBackendTimeoutSeconds());
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(timeout)
        .build();
    return new GlanceAccessor(httpClient, environment.getObjectMapper(),
        URI.create(configuration.getGlanceBaseUrl()), timeout);
  }
}
