package com.codeheadsystems.glance.server.mcp;

/**
 * Identity the gateway reports to agents in {@code initialize}, discovery and health.
 *
 * @param name        server name
 * @param version     server version
 * @param description one-line description
 */
public record McpServerInfo(String name, String version, String description) {

  public static final McpServerInfo GLANCE = new McpServerInfo(
      "glance-art-guide", "1.0.0", "AI-powered art guide for Glance e-ink display");
}
