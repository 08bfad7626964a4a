package com.gentoro.rtmcp.tools;

import com.gentoro.rtmcp.exception.RtMcpException;
import com.gentoro.rtmcp.progress.ProgressSink;
import java.util.Map;
import java.util.Objects;

/**
 * {@link Tool} backed by a {@link ToolHandler}. Logs one line on entry and one on success; a
 * failure is logged and rethrown unchanged.
 */
public class HandlerTool implements Tool {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(HandlerTool.class);

  private final ToolDefinition definition;
  private final ToolHandler handler;

  public HandlerTool(ToolDefinition definition, ToolHandler handler) {
    this.definition = Objects.requireNonNull(definition, "definition");
    this.handler = Objects.requireNonNull(handler, "handler");
  }

  @Override
  public ToolDefinition definition() {
    return definition;
  }

  @Override
  public Object execute(Map<String, Object> arguments, ProgressSink progress) {
    try {
      ToolArguments decoded = ToolArguments.decode(definition, arguments);
      log.info("Invoking {} with {}", definition.name(), decoded);
      Object result = handler.handle(decoded, progress);
      log.info("Completed {}", definition.name());
      return result;
    } catch (RtMcpException e) {
      log.error("Tool {} failed: [{}] {}", definition.name(), e.getCode(), e.getMessage());
      throw e;
    }
  }
}
