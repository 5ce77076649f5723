package com.codeheadsystems.glance.server.resource;

import java.net.URI;

/**
 * Externally visible base URL of the gateway, honouring {@code X-Forwarded-Proto} and
 * {@code X-Forwarded-Host} so metadata served behind a TLS-terminating proxy points at the
 * public address.
 */
public final class RequestBaseUrl {

  public static final String FORWARDED_PROTO = "X-Forwarded-Proto";
  public static final String FORWARDED_HOST = "X-Forwarded-Host";

  private RequestBaseUrl() {
  }

  /**
   * Resolves the base URL, without a trailing slash.
   *
   * @param forwardedProto X-Forwarded-Proto value, may be null
   * @param forwardedHost  X-Forwarded-Host value, may be null
   * @param requestBaseUri base URI the request was received on
   * @return the base URL
   */
  public static String resolve(String forwardedProto, String forwardedHost, URI requestBaseUri) {
    String scheme = firstValue(forwardedProto);
    String host = firstValue(forwardedHost);
    if (scheme == null) {
      scheme = requestBaseUri.getScheme();
    }
    if (host == null) {
      host = requestBaseUri.getRawAuthority();
    }
    String path = requestBaseUri.getRawPath();
    if (path == null || path.equals("/")) {
      path = "";
    } else if (path.endsWith("/")) {
      path = path.substring(0, path.length() - 1);
    }
    return scheme + "://" + host + path;
  }

  private static String firstValue(String header) {
    if (header == null || header.isBlank()) {
      return null;
    }
    int comma = header.indexOf(',');
    String value = (comma < 0 ? header : header.substring(0, comma)).trim();
    return value.isEmpty() ? null : value;
  }
}
