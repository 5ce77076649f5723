package com.codeheadsystems.glance.dropwizard.mcp;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands {@code POST /mcp} to the MCP server's servlet transport and lets every other method
 * fall through to Jersey, which serves discovery and session teardown on the same path.
 * <p>
 * Anything the transport lets escape is logged and answered with a generic 500 body.
 */
public class McpTransportFilter implements Filter {

  static final String INTERNAL_ERROR_BODY = "{\"error\":\"Internal server error\"}";

  private static final Logger log = LoggerFactory.getLogger(McpTransportFilter.class);

  private final HttpServlet transport;

  /**
   * Instantiates a new Mcp transport filter.
   *
   * @param transport the stateless servlet transport the MCP server is bound to
   */
  public McpTransportFilter(HttpServlet transport) {
    this.transport = transport;
  }

  @Override
  public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
      throws IOException, ServletException {
    if (!"POST".equalsIgnoreCase(((HttpServletRequest) request).getMethod())) {
      chain.doFilter(request, response);
      return;
    }
    try {
      transport.service(request, response);
    } catch (RuntimeException e) {
      log.error("MCP request failed", e);
      if (response.isCommitted()) {
        throw e;
      }
      HttpServletResponse httpResponse = (HttpServletResponse) response;
      httpResponse.resetBuffer();
      httpResponse.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
      httpResponse.setContentType("application/json");
      httpResponse.getOutputStream().write(INTERNAL_ERROR_BODY.getBytes(StandardCharsets.UTF_8));
    }
  }
}
