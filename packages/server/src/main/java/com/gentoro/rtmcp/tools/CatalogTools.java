package com.gentoro.rtmcp.tools;

import static com.gentoro.rtmcp.tools.CommonParams.PAGE;
import static com.gentoro.rtmcp.tools.CommonParams.PER_PAGE;
import static com.gentoro.rtmcp.tools.CommonParams.QUERY;
import static com.gentoro.rtmcp.tools.CommonParams.collectionSearch;
import static com.gentoro.rtmcp.tools.CommonParams.flag;
import static com.gentoro.rtmcp.tools.CommonParams.putFlagIfPresent;
import static com.gentoro.rtmcp.tools.CommonParams.putIfPresent;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.BOOLEAN;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.IDENTIFIER;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.STRING;

import com.gentoro.rtmcp.client.RtClient;
import com.gentoro.rtmcp.progress.ProgressSink;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Asset catalogs. */
public class CatalogTools implements ToolProvider {
  private static final ToolProperty CATALOG_ID =
      ToolProperty.required("catalog_id", IDENTIFIER, "Catalog ID or name");

  private final RtClient client;

  public CatalogTools(RtClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public List<Tool> tools() {
    return List.of(
        new HandlerTool(
            ToolDefinition.builder("list_catalogs")
                .description("List all catalogs in RT")
                .tags("catalogs", "read", "basic")
                .readOnly()
                .build(),
            (args, progress) -> client.listCatalogs()),
        new HandlerTool(
            ToolDefinition.builder("get_catalog")
                .description("Get catalog details by ID or name")
                .tags("catalogs", "read", "basic")
                .readOnly()
                .param(CATALOG_ID)
                .build(),
            (args, progress) -> client.getCatalog(args.getString("catalog_id"))),
        new HandlerTool(
            ToolDefinition.builder("create_catalog")
                .description("Create a new catalog")
                .tags("catalogs", "write", "admin")
                .param(ToolProperty.required("name", STRING, "Catalog name"))
                .param(ToolProperty.optional("description", STRING, "Catalog description"))
                .param(
                    ToolProperty.optional("disabled", BOOLEAN, "Create the catalog disabled")
                        .withDefault(false))
                .build(),
            this::createCatalog),
        new HandlerTool(
            ToolDefinition.builder("update_catalog")
                .description("Update an existing catalog")
                .tags("catalogs", "write", "admin")
                .param(CATALOG_ID)
                .param(ToolProperty.optional("name", STRING, "New catalog name"))
                .param(ToolProperty.optional("description", STRING, "New description"))
                .param(ToolProperty.optional("disabled", BOOLEAN, "Catalog disabled"))
                .build(),
            this::updateCatalog),
        new HandlerTool(
            ToolDefinition.builder("delete_catalog")
                .description("Delete a catalog")
                .tags("catalogs", "delete", "admin")
                .destructive()
                .param(CATALOG_ID)
                .build(),
            (args, progress) -> client.deleteCatalog(args.getString("catalog_id"))),
        new HandlerTool(
            ToolDefinition.builder("search_catalogs")
                .description("Search catalogs with RT query syntax")
                .tags("catalogs", "search", "basic")
                .readOnly()
                .param(QUERY)
                .param(PAGE)
                .param(PER_PAGE)
                .build(),
            collectionSearch(client, "catalogs")));
  }

  private Object createCatalog(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("Name", args.getString("name"));
    data.put("Disabled", flag(args.getBoolean("disabled")));
    putIfPresent(data, "Description", args.getString("description"));
    return client.createCatalog(data);
  }

  private Object updateCatalog(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    putIfPresent(data, "Name", args.getString("name"));
    putIfPresent(data, "Description", args.getString("description"));
    putFlagIfPresent(data, "Disabled", args.getBoolean("disabled"));
    return client.updateCatalog(args.getString("catalog_id"), data);
  }
}
