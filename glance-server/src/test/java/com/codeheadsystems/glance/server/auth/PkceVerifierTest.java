package com.codeheadsystems.glance.server.auth;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PkceVerifierTest {

  // RFC 7636 Appendix B
  private static final String VERIFIER = "dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk";
  private static final String CHALLENGE = "E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM";

  @Test
  void challengeFor_matchesRfcVector() {
    assertThat(PkceVerifier.challengeFor(VERIFIER)).isEqualTo(CHALLENGE);
  }

  @Test
  void matches_correctVerifier() {
    assertThat(PkceVerifier.matches(VERIFIER, CHALLENGE)).isTrue();
  }

  @Test
  void matches_wrongVerifier() {
    assertThat(PkceVerifier.matches(VERIFIER + "x", CHALLENGE)).isFalse();
    assertThat(PkceVerifier.matches(VERIFIER, CHALLENGE.toLowerCase())).isFalse();
  }

  @Test
  void matches_nullInputs() {
    assertThat(PkceVerifier.matches(null, CHALLENGE)).isFalse();
    assertThat(PkceVerifier.matches(VERIFIER, null)).isFalse();
  }

  @Test
  void isSupportedMethod_onlyS256OrDefault() {
    assertThat(PkceVerifier.isSupportedMethod("S256")).isTrue();
    assertThat(PkceVerifier.isSupportedMethod(null)).isTrue();
    assertThat(PkceVerifier.isSupportedMethod("")).isTrue();
    assertThat(PkceVerifier.isSupportedMethod("plain")).isFalse();
    assertThat(PkceVerifier.isSupportedMethod("s256")).isFalse();
  }
}
