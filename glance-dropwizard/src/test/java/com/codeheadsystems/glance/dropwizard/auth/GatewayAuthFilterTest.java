package com.codeheadsystems.glance.dropwizard.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.glance.server.auth.CallerAddressResolver;
import com.codeheadsystems.glance.server.auth.GatewayPrincipal;
import com.codeheadsystems.glance.server.auth.GatewayPrincipal.AuthenticationMethod;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.auth.Authenticator;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.WriteListener;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.ByteArrayOutputStream;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GatewayAuthFilterTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Mock private Authenticator<GatewayCredentials, GatewayPrincipal> authenticator;
  @Mock private HttpServletRequest request;
  @Mock private HttpServletResponse response;
  @Mock private FilterChain chain;

  private GatewayAuthFilter filter;

  @BeforeEach
  void setUp() {
    filter = new GatewayAuthFilter(authenticator, new CallerAddressResolver(false), MAPPER, "glance");
  }

  // ── Filtering ────────────────────────────────────────────────────────────

  @Test
  void get_passesThroughWithoutAuthenticating() throws Exception {
    when(request.getMethod()).thenReturn("GET");

    filter.doFilter(request, response, chain);

    verify(chain).doFilter(request, response);
    verifyNoInteractions(authenticator);
  }

  @Test
  void post_accepted_exposesPrincipalDownstream() throws Exception {
    GatewayPrincipal principal = new GatewayPrincipal("claude", AuthenticationMethod.BEARER_TOKEN);
    when(request.getMethod()).thenReturn("POST");
    when(request.getHeader("Authorization")).thenReturn("Bearer abc");
    when(request.getRemoteAddr()).thenReturn("10.0.0.7");
    when(authenticator.authenticate(new GatewayCredentials("abc", "10.0.0.7"))).thenReturn(Optional.of(principal));

    filter.doFilter(request, response, chain);

    ArgumentCaptor<ServletRequest> forwarded = ArgumentCaptor.forClass(ServletRequest.class);
    verify(chain).doFilter(forwarded.capture(), any());
    assertThat(((HttpServletRequest) forwarded.getValue()).getUserPrincipal()).isEqualTo(principal);
    verify(response, never()).setStatus(401);
  }

  @Test
  void post_rejected_writesChallengeAndStops() throws Exception {
    ByteArrayOutputStream body = new ByteArrayOutputStream();
    when(request.getMethod()).thenReturn("POST");
    when(request.getRemoteAddr()).thenReturn("10.0.0.7");
    when(request.getRequestURL()).thenReturn(new StringBuffer("http://localhost:3001/mcp"));
    when(request.getRequestURI()).thenReturn("/mcp");
    when(request.getContextPath()).thenReturn("");
    when(response.getOutputStream()).thenReturn(capture(body));
    when(authenticator.authenticate(new GatewayCredentials(null, "10.0.0.7"))).thenReturn(Optional.empty());

    filter.doFilter(request, response, chain);

    verify(response).setStatus(401);
    verify(response).setHeader("WWW-Authenticate", "Bearer realm=\"glance\", error=\"invalid_token\", "
        + "resource_metadata=\"http://localhost:3001/.well-known/oauth-protected-resource\"");
    JsonNode json = MAPPER.readTree(body.toByteArray());
    assertThat(json.get("error").asText()).isEqualTo("invalid_token");
    assertThat(json.get("error_description").asText()).isEqualTo("Missing bearer token");
    verifyNoInteractions(chain);
  }

  @Test
  void requestBaseUri_keepsContextPath() {
    when(request.getRequestURL()).thenReturn(new StringBuffer("http://localhost:3001/app/mcp"));
    when(request.getRequestURI()).thenReturn("/app/mcp");
    when(request.getContextPath()).thenReturn("/app");

    assertThat(GatewayAuthFilter.requestBaseUri(request)).hasToString("http://localhost:3001/app/");
  }

  private static ServletOutputStream capture(ByteArrayOutputStream target) {
    return new ServletOutputStream() {
      @Override
      public boolean isReady() {
        return true;
      }

      @Override
      public void setWriteListener(WriteListener writeListener) {
      }

      @Override
      public void write(int b) {
        target.write(b);
      }
    };
  }

  // ── Bearer header parsing ────────────────────────────────────────────────

  @Test
  void bearerToken_extractsToken() {
    assertThat(GatewayAuthFilter.bearerToken("Bearer abc.def.ghi")).isEqualTo("abc.def.ghi");
  }

  @Test
  void bearerToken_schemeIsCaseInsensitive() {
    assertThat(GatewayAuthFilter.bearerToken("bearer abc")).isEqualTo("abc");
  }

  @Test
  void bearerToken_trimsSurroundingWhitespace() {
    assertThat(GatewayAuthFilter.bearerToken("Bearer   abc  ")).isEqualTo("abc");
  }

  @Test
  void bearerToken_absentHeader_returnsNull() {
    assertThat(GatewayAuthFilter.bearerToken(null)).isNull();
  }

  @Test
  void bearerToken_otherScheme_returnsNull() {
    assertThat(GatewayAuthFilter.bearerToken("Basic dXNlcjpwYXNz")).isNull();
  }

  @Test
  void bearerToken_schemeWithoutToken_returnsNull() {
    assertThat(GatewayAuthFilter.bearerToken("Bearer")).isNull();
    assertThat(GatewayAuthFilter.bearerToken("Bearer    ")).isNull();
  }
}
