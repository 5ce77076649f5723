package com.codeheadsystems.glance.dropwizard;

import com.codeheadsystems.glance.server.auth.PkceVerifier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Small HTTP client for integration tests. Never follows redirects so the
 * {@code /authorize} response can be inspected.
 */
class GatewayTestClient {

  static final String MCP_ACCEPT = "application/json, text/event-stream";
  static final String REDIRECT_URI = "https://agent.example.com/callback";
  static final String CODE_VERIFIER = "dBjftJeZ4CVP-mJ92K9vWbJbQ79Z6bjxYW4lpEe2vhU";

  private final HttpClient httpClient = HttpClient.newBuilder()
      .followRedirects(HttpClient.Redirect.NEVER)
      .build();
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final String baseUrl;

  GatewayTestClient(int port) {
    this.baseUrl = String.format("http://localhost:%d", port);
  }

  String baseUrl() {
    return baseUrl;
  }

  HttpResponse<String> get(String path, String... headers) throws IOException, InterruptedException {
    HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET();
    if (headers.length > 0) {
      builder.headers(headers);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  HttpResponse<String> delete(String path) throws IOException, InterruptedException {
    HttpRequest request = HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).DELETE().build();
    return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
  }

  HttpResponse<String> postJson(String path, String body, String... headers)
      throws IOException, InterruptedException {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + path))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body));
    if (headers.length > 0) {
      builder.headers(headers);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  HttpResponse<String> postForm(String path, Map<String, String> form, String... headers)
      throws IOException, InterruptedException {
    String body = form.entrySet().stream()
        .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
            + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + path))
        .header("Content-Type", "application/x-www-form-urlencoded")
        .POST(HttpRequest.BodyPublishers.ofString(body));
    if (headers.length > 0) {
      builder.headers(headers);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  /**
   * Calls {@code /authorize} with a PKCE challenge for {@link #CODE_VERIFIER} and returns the
   * code from the redirect.
   */
  String authorize(String clientId, String state) throws IOException, InterruptedException {
    String challenge = PkceVerifier.challengeFor(CODE_VERIFIER);
    HttpResponse<String> response = get("/authorize?response_type=code"
        + "&client_id=" + clientId
        + "&redirect_uri=" + URLEncoder.encode(REDIRECT_URI, StandardCharsets.UTF_8)
        + "&state=" + state
        + "&code_challenge=" + challenge
        + "&code_challenge_method=S256");
    if (response.statusCode() != 302) {
      throw new IllegalStateException("authorize returned " + response.statusCode() + ": " + response.body());
    }
    String location = response.headers().firstValue("Location").orElseThrow();
    return queryParameter(URI.create(location), "code");
  }

  HttpResponse<String> exchangeCode(String code, String verifier) throws IOException, InterruptedException {
    return postForm("/token", Map.of(
        "grant_type", "authorization_code",
        "code", code,
        "redirect_uri", REDIRECT_URI,
        "code_verifier", verifier));
  }

  String clientCredentialsToken(String clientId, String clientSecret) throws IOException, InterruptedException {
    HttpResponse<String> response = postJson("/token", String.format(
        "{\"grant_type\":\"client_credentials\",\"client_id\":\"%s\",\"client_secret\":\"%s\"}",
        clientId, clientSecret));
    if (response.statusCode() != 200) {
      throw new IllegalStateException("token returned " + response.statusCode() + ": " + response.body());
    }
    return json(response).get("access_token").asText();
  }

  HttpResponse<String> mcp(String jsonRpc, String bearerToken) throws IOException, InterruptedException {
    if (bearerToken == null) {
      return postJson("/mcp", jsonRpc, "Accept", MCP_ACCEPT);
    }
    return postJson("/mcp", jsonRpc, "Accept", MCP_ACCEPT, "Authorization", "Bearer " + bearerToken);
  }

  JsonNode json(HttpResponse<String> response) throws IOException {
    return objectMapper.readTree(response.body());
  }

  static String queryParameter(URI uri, String name) {
    for (String pair : uri.getRawQuery().split("&")) {
      int eq = pair.indexOf('=');
      if (eq > 0 && pair.substring(0, eq).equals(name)) {
        return URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
      }
    }
    return null;
  }
}
