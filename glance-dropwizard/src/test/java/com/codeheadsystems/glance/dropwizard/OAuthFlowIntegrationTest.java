package com.codeheadsystems.glance.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Integration tests for the authorization code and client credentials grants over HTTP.
 * The test configuration turns the address fallback off, so every {@code /mcp} call here
 * needs a bearer token.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class OAuthFlowIntegrationTest {

  static final DropwizardAppExtension<GlanceGatewayConfiguration> APP =
      new DropwizardAppExtension<>(
          GlanceGatewayApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static final String PING = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}";

  private GatewayTestClient client;

  @BeforeEach
  void setUp() {
    client = new GatewayTestClient(APP.getLocalPort());
  }

  // ── /authorize ───────────────────────────────────────────────────────────

  @Test
  void authorize_redirectsWithCodeAndState() throws Exception {
    HttpResponse<String> response = client.get("/authorize?response_type=code&client_id=agent"
        + "&redirect_uri=https%3A%2F%2Fagent.example.com%2Fcallback%3Fx%3D1"
        + "&state=xyz&code_challenge=abc&code_challenge_method=S256");

    assertThat(response.statusCode()).isEqualTo(302);
    URI location = URI.create(response.headers().firstValue("Location").orElseThrow());
    assertThat(location.getHost()).isEqualTo("agent.example.com");
    assertThat(location.getPath()).isEqualTo("/callback");
    assertThat(GatewayTestClient.queryParameter(location, "x")).isEqualTo("1");
    assertThat(GatewayTestClient.queryParameter(location, "state")).isEqualTo("xyz");
    assertThat(GatewayTestClient.queryParameter(location, "code")).isNotBlank();
  }

  @Test
  void authorize_missingChallenge_returns400InvalidRequest() throws Exception {
    HttpResponse<String> response = client.get("/authorize?response_type=code&client_id=agent"
        + "&redirect_uri=https%3A%2F%2Fagent.example.com%2Fcallback");

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(client.json(response).get("error").asText()).isEqualTo("invalid_request");
  }

  @Test
  void authorize_tokenResponseType_returns400Unsupported() throws Exception {
    HttpResponse<String> response = client.get("/authorize?response_type=token&client_id=agent"
        + "&redirect_uri=https%3A%2F%2Fagent.example.com%2Fcallback&code_challenge=abc");

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(client.json(response).get("error").asText()).isEqualTo("unsupported_response_type");
  }

  // ── authorization_code grant ─────────────────────────────────────────────

  @Test
  void authorizationCodeFlow_issuesUsableToken_andRejectsReplay() throws Exception {
    String code = client.authorize("agent", "s1");

    HttpResponse<String> tokenResponse = client.exchangeCode(code, GatewayTestClient.CODE_VERIFIER);
    assertThat(tokenResponse.statusCode()).isEqualTo(200);
    assertThat(tokenResponse.headers().firstValue("Cache-Control")).hasValue("no-store");
    JsonNode token = client.json(tokenResponse);
    assertThat(token.get("token_type").asText()).isEqualTo("Bearer");
    assertThat(token.get("expires_in").asLong()).isEqualTo(3600);
    assertThat(token.get("scope").asText()).isEqualTo("mcp:tools");

    HttpResponse<String> ping = client.mcp(PING, token.get("access_token").asText());
    assertThat(ping.statusCode()).isEqualTo(200);
    assertThat(client.json(ping).get("result").isObject()).isTrue();

    HttpResponse<String> replay = client.exchangeCode(code, GatewayTestClient.CODE_VERIFIER);
    assertThat(replay.statusCode()).isEqualTo(400);
    assertThat(client.json(replay).get("error").asText()).isEqualTo("invalid_grant");
  }

  @Test
  void authorizationCode_wrongVerifier_isRejected_andCodeSurvives() throws Exception {
    String code = client.authorize("agent", "s2");

    HttpResponse<String> wrong = client.exchangeCode(code, "not-the-verifier-that-was-challenged-at-all");
    assertThat(wrong.statusCode()).isEqualTo(400);
    assertThat(client.json(wrong).get("error").asText()).isEqualTo("invalid_grant");

    HttpResponse<String> right = client.exchangeCode(code, GatewayTestClient.CODE_VERIFIER);
    assertThat(right.statusCode()).isEqualTo(200);
  }

  @Test
  void authorizationCode_unknownCode_returns400InvalidGrant() throws Exception {
    HttpResponse<String> response = client.exchangeCode("no-such-code", GatewayTestClient.CODE_VERIFIER);

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(client.json(response).get("error").asText()).isEqualTo("invalid_grant");
  }

  @Test
  void authorizationCode_doesNotRememberAddress_whenFallbackDisabled() throws Exception {
    String code = client.authorize("agent", "s3");
    assertThat(client.exchangeCode(code, GatewayTestClient.CODE_VERIFIER).statusCode()).isEqualTo(200);

    HttpResponse<String> response = client.mcp(PING, null);

    assertThat(response.statusCode()).isEqualTo(401);
  }

  // ── client_credentials grant ─────────────────────────────────────────────

  @Test
  void clientCredentials_jsonBody_returnsToken() throws Exception {
    String token = client.clientCredentialsToken("test-client", "test-secret");

    assertThat(client.mcp(PING, token).statusCode()).isEqualTo(200);
  }

  @Test
  void clientCredentials_basicHeader_returnsToken() throws Exception {
    String basic = Base64.getEncoder()
        .encodeToString("test-client:test-secret".getBytes(StandardCharsets.UTF_8));

    HttpResponse<String> response = client.postForm("/token",
        Map.of("grant_type", "client_credentials"), "Authorization", "Basic " + basic);

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(client.json(response).get("access_token").asText()).isNotBlank();
  }

  @Test
  void clientCredentials_wrongSecret_returns401InvalidClient() throws Exception {
    HttpResponse<String> response = client.postForm("/token", Map.of(
        "grant_type", "client_credentials",
        "client_id", "test-client",
        "client_secret", "wrong"));

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.headers().firstValue("WWW-Authenticate")).isPresent();
    assertThat(client.json(response).get("error").asText()).isEqualTo("invalid_client");
  }

  @Test
  void token_unknownGrantType_returns400() throws Exception {
    HttpResponse<String> response = client.postForm("/token", Map.of("grant_type", "password"));

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(client.json(response).get("error").asText()).isEqualTo("unsupported_grant_type");
  }
}
