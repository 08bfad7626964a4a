package com.gentoro.rtmcp.mcp;

import com.gentoro.rtmcp.exception.ExceptionUtil;
import com.gentoro.rtmcp.exception.RtMcpException;
import com.gentoro.rtmcp.progress.McpProgressSink;
import com.gentoro.rtmcp.progress.NoOpProgressSink;
import com.gentoro.rtmcp.progress.ProgressSink;
import com.gentoro.rtmcp.tools.Tool;
import com.gentoro.rtmcp.tools.ToolDefinition;
import com.gentoro.rtmcp.tools.ToolProperty;
import com.gentoro.rtmcp.utility.JacksonUtility;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bridges a {@link Tool} to the MCP SDK: derives the input schema from the tool parameters and
 * turns the call outcome into a {@link McpSchema.CallToolResult}.
 *
 * <p>A successful call yields the Jackson-serialized result. A failed call yields a result flagged
 * {@code isError} whose text is the exception message; the failure is not propagated to the
 * transport.
 */
public class McpToolAdapter {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(McpToolAdapter.class);

  private final boolean progressEnabled;
  private final long minIntervalMs;
  private final long minDelta;

  public McpToolAdapter(boolean progressEnabled, long minIntervalMs, long minDelta) {
    this.progressEnabled = progressEnabled;
    this.minIntervalMs = minIntervalMs;
    this.minDelta = minDelta;
  }

  public McpServerFeatures.SyncToolSpecification toSpecification(Tool tool) {
    ToolDefinition definition = tool.definition();
    return McpServerFeatures.SyncToolSpecification.builder()
        .tool(
            McpSchema.Tool.builder()
                .name(definition.name())
                .description(definition.description())
                .inputSchema(inputSchema(definition))
                .build())
        .callHandler(
            (exchange, request) -> call(tool, exchange, request.arguments(), request.meta()))
        .build();
  }

  /** JSON schema of the tool arguments; undeclared properties are not allowed. */
  public static McpSchema.JsonSchema inputSchema(ToolDefinition definition) {
    Map<String, Object> properties = new LinkedHashMap<>();
    for (ToolProperty property : definition.parameters()) {
      properties.put(property.name(), property.jsonSchema());
    }
    return new McpSchema.JsonSchema(
        "object",
        properties,
        definition.requiredParameterNames(),
        false,
        Collections.emptyMap(),
        Collections.emptyMap());
  }

  McpSchema.CallToolResult call(
      Tool tool,
      McpSyncServerExchange exchange,
      Map<String, Object> arguments,
      Map<String, Object> meta) {
    try {
      Object progressToken =
          Objects.requireNonNullElse(meta, Collections.<String, Object>emptyMap())
              .get("progressToken");
      ProgressSink sink;
      if (progressEnabled && progressToken != null && exchange != null) {
        sink = new McpProgressSink(log, minIntervalMs, minDelta, exchange, progressToken);
      } else {
        sink = NoOpProgressSink.INSTANCE;
      }

      Object result = tool.execute(arguments, sink);
      return new McpSchema.CallToolResult(JacksonUtility.toJson(result), false);
    } catch (RtMcpException e) {
      // already logged by the tool
      return new McpSchema.CallToolResult(ExceptionUtil.describe(e), true);
    } catch (Exception e) {
      log.error("Unexpected failure in tool {}", tool.name(), e);
      return new McpSchema.CallToolResult(ExceptionUtil.describe(e), true);
    }
  }
}
