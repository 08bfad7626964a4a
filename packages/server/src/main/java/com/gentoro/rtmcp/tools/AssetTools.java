package com.gentoro.rtmcp.tools;

import static com.gentoro.rtmcp.tools.CommonParams.PAGE;
import static com.gentoro.rtmcp.tools.CommonParams.PER_PAGE;
import static com.gentoro.rtmcp.tools.CommonParams.QUERY;
import static com.gentoro.rtmcp.tools.CommonParams.collectionSearch;
import static com.gentoro.rtmcp.tools.CommonParams.putIfPresent;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.INTEGER;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.STRING;

import com.gentoro.rtmcp.client.RtClient;
import com.gentoro.rtmcp.progress.ProgressSink;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class AssetTools implements ToolProvider {
  private static final ToolProperty ASSET_ID =
      ToolProperty.required("asset_id", INTEGER, "Numeric asset ID");

  private final RtClient client;

  public AssetTools(RtClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public List<Tool> tools() {
    return List.of(
        new HandlerTool(
            ToolDefinition.builder("list_assets")
                .description("List all assets in RT")
                .tags("assets", "read", "basic")
                .readOnly()
                .build(),
            (args, progress) -> client.listAssets()),
        new HandlerTool(
            ToolDefinition.builder("get_asset")
                .description("Get asset details by ID")
                .tags("assets", "read", "basic")
                .readOnly()
                .param(ASSET_ID)
                .build(),
            (args, progress) -> client.getAsset(args.getLong("asset_id"))),
        new HandlerTool(
            ToolDefinition.builder("create_asset")
                .description("Create a new asset")
                .tags("assets", "write", "basic")
                .param(ToolProperty.required("name", STRING, "Asset name"))
                .param(ToolProperty.required("catalog", STRING, "Catalog name or ID"))
                .param(ToolProperty.optional("description", STRING, "Asset description"))
                .param(
                    ToolProperty.optional("status", STRING, "Initial status")
                        .withDefault("allocated"))
                .build(),
            this::createAsset),
        new HandlerTool(
            ToolDefinition.builder("update_asset")
                .description("Update an existing asset")
                .tags("assets", "write", "basic")
                .param(ASSET_ID)
                .param(ToolProperty.optional("name", STRING, "New asset name"))
                .param(ToolProperty.optional("description", STRING, "New description"))
                .param(ToolProperty.optional("status", STRING, "New status"))
                .build(),
            this::updateAsset),
        new HandlerTool(
            ToolDefinition.builder("delete_asset")
                .description("Delete an asset")
                .tags("assets", "delete", "admin")
                .destructive()
                .param(ASSET_ID)
                .build(),
            (args, progress) -> client.deleteAsset(args.getLong("asset_id"))),
        new HandlerTool(
            ToolDefinition.builder("search_assets")
                .description("Search assets with RT query syntax")
                .tags("assets", "search", "basic")
                .readOnly()
                .param(QUERY)
                .param(PAGE)
                .param(PER_PAGE)
                .build(),
            collectionSearch(client, "assets")));
  }

  private Object createAsset(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("Name", args.getString("name"));
    data.put("Catalog", args.getString("catalog"));
    data.put("Status", args.getString("status"));
    putIfPresent(data, "Description", args.getString("description"));
    return client.createAsset(data);
  }

  private Object updateAsset(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    putIfPresent(data, "Name", args.getString("name"));
    putIfPresent(data, "Description", args.getString("description"));
    putIfPresent(data, "Status", args.getString("status"));
    return client.updateAsset(args.getLong("asset_id"), data);
  }
}
