package com.codeheadsystems.glance.server.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * PKCE (RFC 7636) support for the {@code S256} method, the only one this gateway accepts.
 * <p>
 * {@code code_challenge = BASE64URL(SHA-256(ASCII(code_verifier)))}, unpadded.
 */
public final class PkceVerifier {

  /**
   * The supported challenge method.
   */
  public static final String S256 = "S256";

  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  private PkceVerifier() {
  }

  /**
   * Computes the S256 challenge for a verifier.
   *
   * @param codeVerifier the verifier
   * @return the challenge
   */
  public static String challengeFor(String codeVerifier) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
      return B64URL.encodeToString(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * Whether the verifier hashes to the stored challenge. Compared in constant time.
   *
   * @param codeVerifier  verifier from the token request, may be null
   * @param codeChallenge challenge recorded at authorization time, may be null
   * @return true on match
   */
  public static boolean matches(String codeVerifier, String codeChallenge) {
    if (codeVerifier == null || codeChallenge == null) {
      return false;
    }
    byte[] computed = challengeFor(codeVerifier).getBytes(StandardCharsets.US_ASCII);
    return MessageDigest.isEqual(computed, codeChallenge.getBytes(StandardCharsets.US_ASCII));
  }

  /**
   * Whether the method names a supported challenge method. A null or empty method defaults
   * to {@code S256}.
   *
   * @param method the method, may be null
   * @return true if supported
   */
  public static boolean isSupportedMethod(String method) {
    return method == null || method.isEmpty() || S256.equals(method);
  }
}
