package com.codeheadsystems.glance.server.mcp;

import com.codeheadsystems.glance.server.accessor.GlanceAccessor;
import com.codeheadsystems.glance.server.bridge.ResultBridge;
import com.codeheadsystems.glance.server.tool.GlanceToolCatalog;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpStatelessSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpStatelessServerTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the stateless MCP server that answers {@code initialize}, {@code ping},
 * {@code tools/list} and {@code tools/call} with the Glance tools.
 * <p>
 * The server keeps no session: every POST is handled on its own, so any gateway instance can
 * answer any request.
 */
public class McpServerFactory {

  private static final Logger log = LoggerFactory.getLogger(McpServerFactory.class);

  private final GlanceAccessor accessor;
  private final ResultBridge bridge;
  private final McpServerInfo serverInfo;

  public McpServerFactory(GlanceAccessor accessor, ResultBridge bridge, McpServerInfo serverInfo) {
    this.accessor = accessor;
    this.bridge = bridge;
    this.serverInfo = serverInfo;
  }

  /**
   * Creates the server and binds it to the transport.
   *
   * @param transport the stateless transport receiving POSTed JSON-RPC messages
   * @return the server, to be closed on shutdown
   */
  public McpStatelessSyncServer create(McpStatelessServerTransport transport) {
    log.info("create({} {})", serverInfo.name(), serverInfo.version());
    return McpServer.sync(transport)
        .serverInfo(serverInfo.name(), serverInfo.version())
        .instructions(serverInfo.description())
        .capabilities(McpSchema.ServerCapabilities.builder()
            .tools(false)
            .build())
        .tools(GlanceToolCatalog.build(accessor, bridge))
        .build();
  }

  public McpServerInfo serverInfo() {
    return serverInfo;
  }
}
