package com.codeheadsystems.glance.server.tool;

import io.modelcontextprotocol.spec.McpSchema;
import java.util.Map;

/**
 * Factories for the single-text-block results every Glance tool returns.
 */
public final class ToolResults {

  private ToolResults() {
  }

  public static McpSchema.CallToolResult text(String text) {
    return McpSchema.CallToolResult.builder()
        .addTextContent(text)
        .build();
  }

  /**
   * A successful result that also carries the raw backend data in {@code _meta}, so clients
   * that render artworks do not have to parse the text.
   *
   * @param text     text shown to the agent
   * @param metadata raw data, keyed by what it is ({@code results}, {@code device}, ...)
   * @return the result
   */
  public static McpSchema.CallToolResult text(String text, Map<String, Object> metadata) {
    return McpSchema.CallToolResult.builder()
        .addTextContent(text)
        .meta(metadata)
        .build();
  }

  public static McpSchema.CallToolResult error(String text) {
    return McpSchema.CallToolResult.builder()
        .addTextContent(text)
        .isError(true)
        .build();
  }
}
