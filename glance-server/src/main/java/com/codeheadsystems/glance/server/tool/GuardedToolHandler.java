package com.codeheadsystems.glance.server.tool;

import io.modelcontextprotocol.spec.McpSchema;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a handler so that it never throws: every failure becomes a result with
 * {@code isError} set and a message prefixed with what the tool was trying to do.
 */
public final class GuardedToolHandler implements Function<ToolArguments, McpSchema.CallToolResult> {

  private static final Logger log = LoggerFactory.getLogger(GuardedToolHandler.class);

  private final String toolName;
  private final String failurePrefix;
  private final ToolHandler delegate;

  private GuardedToolHandler(String toolName, String failurePrefix, ToolHandler delegate) {
    this.toolName = toolName;
    this.failurePrefix = failurePrefix;
    this.delegate = delegate;
  }

  /**
   * Guards a handler.
   *
   * @param toolName      tool name, for logging
   * @param failurePrefix prefix of the failure text, e.g. {@code "Search failed"}
   * @param delegate      the handler to guard
   * @return the guarded handler
   */
  public static GuardedToolHandler guard(String toolName, String failurePrefix, ToolHandler delegate) {
    return new GuardedToolHandler(toolName, failurePrefix, delegate);
  }

  @Override
  public McpSchema.CallToolResult apply(ToolArguments arguments) {
    try {
      McpSchema.CallToolResult result = delegate.handle(arguments);
      if (result == null) {
        log.error("Tool {} returned no result", toolName);
        return ToolResults.error(failurePrefix + ": no result");
      }
      return result;
    } catch (InvalidToolArgumentException e) {
      log.warn("Tool {} called with invalid arguments: {}", toolName, e.getMessage());
      return ToolResults.error(failurePrefix + ": " + e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("Tool {} interrupted", toolName, e);
      return ToolResults.error(failurePrefix + ": interrupted");
    } catch (Exception e) {
      log.error("Tool {} failed", toolName, e);
      return ToolResults.error(failurePrefix + ": " + messageOf(e));
    }
  }

  private static String messageOf(Throwable e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }
}
