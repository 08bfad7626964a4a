package com.gentoro.rtmcp.tools;

import static com.gentoro.rtmcp.tools.CommonParams.PAGE;
import static com.gentoro.rtmcp.tools.CommonParams.PER_PAGE;
import static com.gentoro.rtmcp.tools.CommonParams.QUERY;
import static com.gentoro.rtmcp.tools.CommonParams.collectionSearch;
import static com.gentoro.rtmcp.tools.CommonParams.putIfPresent;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.IDENTIFIER;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.STRING;

import com.gentoro.rtmcp.client.RtClient;
import com.gentoro.rtmcp.progress.ProgressSink;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class CustomRoleTools implements ToolProvider {
  private static final ToolProperty ROLE_ID =
      ToolProperty.required("role_id", IDENTIFIER, "Custom role ID or name");

  private final RtClient client;

  public CustomRoleTools(RtClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public List<Tool> tools() {
    return List.of(
        new HandlerTool(
            ToolDefinition.builder("list_custom_roles")
                .description("List all custom roles in RT")
                .tags("custom-roles", "read", "admin")
                .readOnly()
                .build(),
            (args, progress) -> client.listCustomRoles()),
        new HandlerTool(
            ToolDefinition.builder("get_custom_role")
                .description("Get custom role details by ID or name")
                .tags("custom-roles", "read", "admin")
                .readOnly()
                .param(ROLE_ID)
                .build(),
            (args, progress) -> client.getCustomRole(args.getString("role_id"))),
        new HandlerTool(
            ToolDefinition.builder("create_custom_role")
                .description("Create a new custom role")
                .tags("custom-roles", "write", "admin")
                .param(ToolProperty.required("name", STRING, "Custom role name"))
                .param(ToolProperty.optional("description", STRING, "Role description"))
                .build(),
            this::createRole),
        new HandlerTool(
            ToolDefinition.builder("update_custom_role")
                .description("Update an existing custom role")
                .tags("custom-roles", "write", "admin")
                .param(ROLE_ID)
                .param(ToolProperty.optional("name", STRING, "New role name"))
                .param(ToolProperty.optional("description", STRING, "New description"))
                .build(),
            this::updateRole),
        new HandlerTool(
            ToolDefinition.builder("delete_custom_role")
                .description("Delete a custom role")
                .tags("custom-roles", "delete", "admin")
                .destructive()
                .param(ROLE_ID)
                .build(),
            (args, progress) -> client.deleteCustomRole(args.getString("role_id"))),
        new HandlerTool(
            ToolDefinition.builder("search_custom_roles")
                .description("Search custom roles with RT query syntax")
                .tags("custom-roles", "search", "admin")
                .readOnly()
                .param(QUERY)
                .param(PAGE)
                .param(PER_PAGE)
                .build(),
            collectionSearch(client, "customroles")));
  }

  private Object createRole(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("Name", args.getString("name"));
    putIfPresent(data, "Description", args.getString("description"));
    return client.createCustomRole(data);
  }

  private Object updateRole(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    putIfPresent(data, "Name", args.getString("name"));
    putIfPresent(data, "Description", args.getString("description"));
    return client.updateCustomRole(args.getString("role_id"), data);
  }
}
