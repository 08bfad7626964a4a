package com.gentoro.rtmcp.mcp;

import com.gentoro.rtmcp.client.RtClient;
import com.gentoro.rtmcp.exception.ExceptionUtil;
import com.gentoro.rtmcp.exception.RtMcpException;
import com.gentoro.rtmcp.utility.JacksonUtility;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Read-only reference data published as MCP resources. Each resource renders a JSON document; a
 * failed RT call renders {@code {"error": <message>}} instead of failing the read.
 */
public class McpResources {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(McpResources.class);

  public static final String QUEUES = "rt://queues/list";
  public static final String CUSTOM_FIELDS = "rt://custom-fields/list";
  public static final String CURRENT_USER = "rt://user/current";
  public static final String SERVER_INFO = "rt://server/info";

  private static final String MIME_TYPE = "application/json";

  private record Source(String name, String description, Supplier<Map<String, Object>> reader) {}

  private final Map<String, Source> sources = new LinkedHashMap<>();

  public McpResources(RtClient client) {
    Objects.requireNonNull(client, "client");
    sources.put(QUEUES, new Source("queues", "All RT queues", client::listQueues));
    sources.put(
        CUSTOM_FIELDS,
        new Source("custom-fields", "All RT custom fields", client::listCustomFields));
    sources.put(
        CURRENT_USER,
        new Source("current-user", "The authenticated RT user", client::getCurrentUser));
    sources.put(
        SERVER_INFO, new Source("server-info", "RT server information", client::serverInfo));
  }

  public List<String> uris() {
    return List.copyOf(sources.keySet());
  }

  public List<McpServerFeatures.SyncResourceSpecification> specifications() {
    return sources.entrySet().stream()
        .map(e -> specification(e.getKey(), e.getValue()))
        .collect(Collectors.toList());
  }

  /** Render the JSON body of the resource at {@code uri}. */
  public String read(String uri) {
    Source source = sources.get(uri);
    if (source == null) {
      throw new IllegalArgumentException("Unknown resource: " + uri);
    }
    log.info("Reading resource {}", uri);
    try {
      return JacksonUtility.toJson(source.reader().get());
    } catch (RtMcpException e) {
      log.error("Failed to read resource {}: {}", uri, e.getMessage());
      return JacksonUtility.toJson(Map.of("error", ExceptionUtil.describe(e)));
    }
  }

  private McpServerFeatures.SyncResourceSpecification specification(String uri, Source source) {
    McpSchema.Resource resource =
        McpSchema.Resource.builder()
            .uri(uri)
            .name(source.name())
            .description(source.description())
            .mimeType(MIME_TYPE)
            .build();
    return new McpServerFeatures.SyncResourceSpecification(
        resource,
        (exchange, request) ->
            new McpSchema.ReadResourceResult(
                List.of(new McpSchema.TextResourceContents(uri, MIME_TYPE, read(uri)))));
  }
}
