package com.codeheadsystems.glance.server.tool;

import io.modelcontextprotocol.spec.McpSchema;

/**
 * Executes one tool call.
 * <p>
 * Handlers may throw; {@link GuardedToolHandler} turns any exception into an error result
 * before it reaches the MCP server.
 */
@FunctionalInterface
public interface ToolHandler {

  /**
   * Runs the tool.
   *
   * @param arguments the call arguments, never null
   * @return the result
   * @throws Exception on any failure
   */
  McpSchema.CallToolResult handle(ToolArguments arguments) throws Exception;
}
