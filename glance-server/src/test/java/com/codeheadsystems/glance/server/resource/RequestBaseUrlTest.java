package com.codeheadsystems.glance.server.resource;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import org.junit.jupiter.api.Test;

class RequestBaseUrlTest {

  private static final URI LOCAL = URI.create("http://localhost:8080/");

  @Test
  void noForwardedHeaders_usesRequestBase() {
    assertThat(RequestBaseUrl.resolve(null, null, LOCAL)).isEqualTo("http://localhost:8080");
  }

  @Test
  void forwardedHeaders_win() {
    assertThat(RequestBaseUrl.resolve("https", "glance.example.com", LOCAL))
        .isEqualTo("https://glance.example.com");
  }

  @Test
  void forwardedHeaders_multipleValues_firstUsed() {
    assertThat(RequestBaseUrl.resolve("https, http", "glance.example.com, proxy.internal", LOCAL))
        .isEqualTo("https://glance.example.com");
  }

  @Test
  void contextPath_kept() {
    assertThat(RequestBaseUrl.resolve(null, null, URI.create("http://localhost:8080/api/")))
        .isEqualTo("http://localhost:8080/api");
  }
}
