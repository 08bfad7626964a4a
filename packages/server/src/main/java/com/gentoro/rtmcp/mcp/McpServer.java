package com.gentoro.rtmcp.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.rtmcp.http.EmbeddedJettyServer;
import com.gentoro.rtmcp.tools.Tool;
import com.gentoro.rtmcp.tools.ToolRegistry;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Streamable HTTP MCP endpoint mounted on the shared Jetty context.
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> (string) – servlet path; default: "/mcp"
 *   <li><b>http.mcp.disallow-delete</b> (boolean) – reject HTTP DELETE; default: false
 *   <li><b>http.mcp.server.name</b> (string) – server name reported to clients; default:
 *       "rt-mcp-server"
 *   <li><b>http.mcp.server.version</b> (string) – default: "0.1.0"
 *   <li><b>http.mcp.progress.enabled</b>, <b>.min-interval-ms</b>, <b>.min-delta</b> – progress
 *       notifications for callers that send a progress token
 * </ul>
 */
public class McpServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(McpServer.class);

  static final String INSTRUCTIONS =
      """
      Request Tracker (RT) REST2 API MCP Server

      Provides access to RT tickets, queues, users, groups, assets, catalogs, transactions,
      attachments, custom fields and custom roles.

      Tools are tagged by resource type, by operation (read, write, delete, search) and by
      permission level (basic, power-user, admin).

      Long-running tools (advanced_ticket_search, bulk_update) report progress when the
      request carries a progress token.
      """;

  private final Configuration configuration;
  private final ToolRegistry registry;
  private final McpResources resources;
  private final EmbeddedJettyServer httpServer;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public McpServer(
      Configuration configuration,
      ToolRegistry registry,
      McpResources resources,
      EmbeddedJettyServer httpServer) {
    this.configuration = configuration;
    this.registry = registry;
    this.resources = resources;
    this.httpServer = httpServer;
  }

  /** Build the MCP server and register its servlet, without managing the Jetty lifecycle. */
  public void register() {
    String endpoint = normalizeEndpoint(configuration.getString("http.mcp.endpoint", "/mcp"));
    boolean disallowDelete = configuration.getBoolean("http.mcp.disallow-delete", false);
    String serverName = configuration.getString("http.mcp.server.name", "rt-mcp-server");
    String serverVersion = configuration.getString("http.mcp.server.version", "0.1.0");

    McpToolAdapter adapter =
        new McpToolAdapter(
            configuration.getBoolean("http.mcp.progress.enabled", true),
            configuration.getLong("http.mcp.progress.min-interval-ms", 300L),
            configuration.getLong("http.mcp.progress.min-delta", 1L));
    List<McpServerFeatures.SyncToolSpecification> tools =
        registry.all().stream().map(adapter::toSpecification).collect(Collectors.toList());

    var json = new JacksonMcpJsonMapper(new ObjectMapper());
    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(json)
            .mcpEndpoint(endpoint)
            .disallowDelete(disallowDelete)
            .build();

    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(servletTransport)
            .serverInfo(serverName, serverVersion)
            .instructions(INSTRUCTIONS)
            .capabilities(
                McpSchema.ServerCapabilities.builder()
                    .tools(true)
                    .resources(false, false)
                    .logging()
                    .build())
            .tools(tools)
            .resources(resources.specifications())
            .build();

    httpServer.getContextHandler().addServlet(new ServletHolder(servletTransport), endpoint);
    log.info(
        "MCP servlet registered at {} with {} tools: {}",
        endpoint,
        tools.size(),
        registry.all().stream().map(Tool::name).collect(Collectors.joining(", ")));
  }

  /** Clean up MCP transport/resources. */
  @Override
  public void close() {
    if (mcpServer != null) {
      try {
        mcpServer.closeGracefully();
      } finally {
        mcpServer = null;
      }
    }
    if (servletTransport != null) {
      try {
        servletTransport.destroy();
      } finally {
        servletTransport = null;
      }
    }
  }

  private static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
  }
}
