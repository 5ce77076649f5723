package com.codeheadsystems.glance.server.auth;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves the address a request came from.
 * <p>
 * Behind a reverse proxy every request arrives from the proxy, so the first
 * {@code X-Forwarded-For} hop is used instead when {@code trustForwardedFor} is on. The header
 * is client-controlled; only enable this when a proxy you operate overwrites it.
 */
public class CallerAddressResolver {

  static final String FORWARDED_FOR = "X-Forwarded-For";

  private final boolean trustForwardedFor;

  public CallerAddressResolver(boolean trustForwardedFor) {
    this.trustForwardedFor = trustForwardedFor;
  }

  /**
   * Resolves the caller address.
   *
   * @param request the servlet request
   * @return the address, or null if none is available
   */
  public String resolve(HttpServletRequest request) {
    if (request == null) {
      return null;
    }
    return resolve(request.getHeader(FORWARDED_FOR), request.getRemoteAddr());
  }

  /**
   * Resolves the caller address from raw values.
   *
   * @param forwardedFor  the X-Forwarded-For header value, may be null
   * @param remoteAddress the socket peer address, may be null
   * @return the address
   */
  public String resolve(String forwardedFor, String remoteAddress) {
    if (trustForwardedFor && forwardedFor != null && !forwardedFor.isBlank()) {
      int comma = forwardedFor.indexOf(',');
      String first = comma < 0 ? forwardedFor : forwardedFor.substring(0, comma);
      if (!first.isBlank()) {
        return first.trim();
      }
    }
    return remoteAddress;
  }
}
