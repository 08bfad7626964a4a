package com.gentoro.rtmcp.mcp;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.rtmcp.exception.NotFoundException;
import com.gentoro.rtmcp.progress.NoOpProgressSink;
import com.gentoro.rtmcp.progress.ProgressSink;
import com.gentoro.rtmcp.tools.HandlerTool;
import com.gentoro.rtmcp.tools.Tool;
import com.gentoro.rtmcp.tools.ToolDefinition;
import com.gentoro.rtmcp.tools.ToolProperty;
import com.gentoro.rtmcp.utility.JacksonUtility;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class McpToolAdapterTest {

  private static final ToolDefinition GET_TICKET =
      ToolDefinition.builder("get_ticket")
          .description("Get ticket details by ID")
          .tags("tickets", "read", "basic")
          .readOnly()
          .param(ToolProperty.required("ticket_id", ToolProperty.Type.INTEGER, "Ticket ID"))
          .param(
              ToolProperty.optional("page", ToolProperty.Type.INTEGER, "Page").withDefault(1))
          .build();

  private final McpToolAdapter adapter = new McpToolAdapter(true, 0, 1);

  @Test
  void inputSchemaListsPropertiesAndRequiredNames() {
    McpSchema.JsonSchema schema = McpToolAdapter.inputSchema(GET_TICKET);

    assertEquals("object", schema.type());
    assertEquals(List.of("ticket_id"), schema.required());
    assertEquals(Boolean.FALSE, schema.additionalProperties());
    assertEquals(
        Map.of("type", "integer", "description", "Page", "default", 1),
        schema.properties().get("page"));
  }

  @Test
  void successfulCallReturnsJsonText() {
    Tool tool =
        new HandlerTool(GET_TICKET, (args, progress) -> Map.of("id", args.getLong("ticket_id")));

    McpSchema.CallToolResult result = adapter.call(tool, null, Map.of("ticket_id", 12), null);

    assertFalse(result.isError());
    Map<String, Object> body = parse(text(result));
    assertEquals(12, body.get("id"));
  }

  @Test
  void failureBecomesErrorResult() {
    Tool tool =
        new HandlerTool(
            GET_TICKET,
            (args, progress) -> {
              throw new NotFoundException("Resource not found: ticket 12", 404);
            });

    McpSchema.CallToolResult result = adapter.call(tool, null, Map.of("ticket_id", 12), null);

    assertTrue(result.isError());
    assertEquals("Resource not found: ticket 12", text(result));
  }

  @Test
  void invalidArgumentsBecomeErrorResult() {
    Tool tool = new HandlerTool(GET_TICKET, (args, progress) -> Map.of());

    McpSchema.CallToolResult result = adapter.call(tool, null, Map.of(), null);

    assertTrue(result.isError());
    assertEquals("Missing required argument: ticket_id", text(result));
  }

  @Test
  void unexpectedExceptionsAreContained() {
    Tool tool =
        new HandlerTool(
            GET_TICKET,
            (args, progress) -> {
              throw new IllegalStateException("boom");
            });

    McpSchema.CallToolResult result = adapter.call(tool, null, Map.of("ticket_id", 1), null);

    assertTrue(result.isError());
    assertEquals("boom", text(result));
  }

  @Test
  void progressNeedsAnExchange() {
    AtomicReference<ProgressSink> seen = new AtomicReference<>();
    Tool tool =
        new HandlerTool(
            GET_TICKET,
            (args, progress) -> {
              seen.set(progress);
              return Map.of();
            });

    adapter.call(tool, null, Map.of("ticket_id", 1), Map.of("progressToken", "abc"));

    assertSame(NoOpProgressSink.INSTANCE, seen.get());
  }

  private static String text(McpSchema.CallToolResult result) {
    return ((McpSchema.TextContent) result.content().get(0)).text();
  }

  private static Map<String, Object> parse(String json) {
    return JacksonUtility.readMap(json);
  }
}
