package com.codeheadsystems.glance.dropwizard.lifecycle;

import io.dropwizard.lifecycle.Managed;
import io.modelcontextprotocol.server.McpStatelessSyncServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closes the MCP server, and with it its transport, when the application stops.
 */
public class McpServerManager implements Managed {

  private static final Logger log = LoggerFactory.getLogger(McpServerManager.class);

  private final McpStatelessSyncServer mcpServer;

  public McpServerManager(McpStatelessSyncServer mcpServer) {
    this.mcpServer = mcpServer;
  }

  @Override
  public void stop() {
    log.info("Closing MCP server");
    mcpServer.closeGracefully();
  }
}
