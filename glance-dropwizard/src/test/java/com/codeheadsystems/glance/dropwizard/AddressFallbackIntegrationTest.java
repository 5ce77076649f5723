package com.codeheadsystems.glance.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import io.dropwizard.testing.ConfigOverride;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Integration test for the cached-address fallback: a caller that completed the authorization
 * code flow may call {@code /mcp} without its bearer token.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class AddressFallbackIntegrationTest {

  static final DropwizardAppExtension<GlanceGatewayConfiguration> APP =
      new DropwizardAppExtension<>(
          GlanceGatewayApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"),
          ConfigOverride.config("addressFallbackEnabled", "true"));

  private static final String PING = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}";

  @Test
  void tokenlessCall_isAccepted_onlyAfterCodeExchange() throws Exception {
    GatewayTestClient client = new GatewayTestClient(APP.getLocalPort());

    assertThat(client.mcp(PING, null).statusCode()).isEqualTo(401);

    String code = client.authorize("agent", "fallback");
    assertThat(client.exchangeCode(code, GatewayTestClient.CODE_VERIFIER).statusCode()).isEqualTo(200);

    HttpResponse<String> response = client.mcp(PING, null);
    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(client.json(response).get("result").isObject()).isTrue();
  }
}
