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

public class GroupTools implements ToolProvider {
  private static final ToolProperty GROUP_ID =
      ToolProperty.required("group_id", IDENTIFIER, "Group ID or name");
  private static final ToolProperty USER_ID =
      ToolProperty.required("user_id", IDENTIFIER, "User ID or username");

  private final RtClient client;

  public GroupTools(RtClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public List<Tool> tools() {
    return List.of(
        new HandlerTool(
            ToolDefinition.builder("list_groups")
                .description("List all groups in RT")
                .tags("groups", "read", "basic")
                .readOnly()
                .build(),
            (args, progress) -> client.listGroups()),
        new HandlerTool(
            ToolDefinition.builder("get_group")
                .description("Get group details by ID or name")
                .tags("groups", "read", "basic")
                .readOnly()
                .param(GROUP_ID)
                .build(),
            (args, progress) -> client.getGroup(args.getString("group_id"))),
        new HandlerTool(
            ToolDefinition.builder("create_group")
                .description("Create a new group")
                .tags("groups", "write", "admin")
                .param(ToolProperty.required("name", STRING, "Group name"))
                .param(ToolProperty.optional("description", STRING, "Group description"))
                .build(),
            this::createGroup),
        new HandlerTool(
            ToolDefinition.builder("update_group")
                .description("Update an existing group")
                .tags("groups", "write", "admin")
                .param(GROUP_ID)
                .param(ToolProperty.optional("name", STRING, "New group name"))
                .param(ToolProperty.optional("description", STRING, "New description"))
                .build(),
            this::updateGroup),
        new HandlerTool(
            ToolDefinition.builder("delete_group")
                .description("Delete a group")
                .tags("groups", "delete", "admin")
                .destructive()
                .param(GROUP_ID)
                .build(),
            (args, progress) -> client.deleteGroup(args.getString("group_id"))),
        new HandlerTool(
            ToolDefinition.builder("add_group_member")
                .description("Add a user to a group")
                .tags("groups", "write", "admin")
                .param(GROUP_ID)
                .param(USER_ID)
                .build(),
            (args, progress) ->
                client.addGroupMember(args.getString("group_id"), args.getString("user_id"))),
        new HandlerTool(
            ToolDefinition.builder("remove_group_member")
                .description("Remove a user from a group")
                .tags("groups", "write", "admin")
                .param(GROUP_ID)
                .param(USER_ID)
                .build(),
            (args, progress) ->
                client.removeGroupMember(args.getString("group_id"), args.getString("user_id"))),
        new HandlerTool(
            ToolDefinition.builder("search_groups")
                .description("Search groups with RT query syntax")
                .tags("groups", "search", "basic")
                .readOnly()
                .param(QUERY)
                .param(PAGE)
                .param(PER_PAGE)
                .build(),
            collectionSearch(client, "groups")));
  }

  private Object createGroup(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("Name", args.getString("name"));
    putIfPresent(data, "Description", args.getString("description"));
    return client.createGroup(data);
  }

  private Object updateGroup(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    putIfPresent(data, "Name", args.getString("name"));
    putIfPresent(data, "Description", args.getString("description"));
    return client.updateGroup(args.getString("group_id"), data);
  }
}
