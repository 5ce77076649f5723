package com.codeheadsystems.glance.server.auth;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CallerAddressResolverTest {

  @Test
  void untrusted_ignoresForwardedFor() {
    CallerAddressResolver resolver = new CallerAddressResolver(false);

    assertThat(resolver.resolve("198.51.100.1", "127.0.0.1")).isEqualTo("127.0.0.1");
  }

  @Test
  void trusted_usesFirstHop() {
    CallerAddressResolver resolver = new CallerAddressResolver(true);

    assertThat(resolver.resolve(" 198.51.100.1 , 10.0.0.1", "127.0.0.1")).isEqualTo("198.51.100.1");
  }

  @Test
  void trusted_blankHeader_usesRemoteAddress() {
    CallerAddressResolver resolver = new CallerAddressResolver(true);

    assertThat(resolver.resolve("  ", "127.0.0.1")).isEqualTo("127.0.0.1");
    assertThat(resolver.resolve(null, "127.0.0.1")).isEqualTo("127.0.0.1");
  }
}
