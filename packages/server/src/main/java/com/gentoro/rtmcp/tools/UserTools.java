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

/** User accounts, including the enable/disable and privilege toggles. */
public class UserTools implements ToolProvider {
  private static final ToolProperty USER_ID =
      ToolProperty.required("user_id", IDENTIFIER, "User ID or username");

  private final RtClient client;

  public UserTools(RtClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public List<Tool> tools() {
    return List.of(
        new HandlerTool(
            ToolDefinition.builder("list_users")
                .description("List all users in RT")
                .tags("users", "read", "basic")
                .readOnly()
                .build(),
            (args, progress) -> client.listUsers()),
        new HandlerTool(
            ToolDefinition.builder("get_user")
                .description("Get user details by ID or username")
                .tags("users", "read", "basic")
                .readOnly()
                .param(USER_ID)
                .build(),
            (args, progress) -> client.getUser(args.getString("user_id"))),
        new HandlerTool(
            ToolDefinition.builder("get_current_user")
                .description("Get current authenticated user details")
                .tags("users", "read", "basic")
                .readOnly()
                .build(),
            (args, progress) -> client.getCurrentUser()),
        new HandlerTool(
            ToolDefinition.builder("create_user")
                .description("Create a new user")
                .tags("users", "write", "admin")
                .param(ToolProperty.required("name", STRING, "Username"))
                .param(ToolProperty.required("email_address", STRING, "Email address"))
                .param(ToolProperty.optional("real_name", STRING, "Full name"))
                .param(ToolProperty.optional("password", STRING, "Initial password"))
                .param(
                    ToolProperty.optional("privileged", BOOLEAN, "Grant privileged access")
                        .withDefault(false))
                .param(
                    ToolProperty.optional("disabled", BOOLEAN, "Create the account disabled")
                        .withDefault(false))
                .build(),
            this::createUser),
        new HandlerTool(
            ToolDefinition.builder("update_user")
                .description("Update an existing user")
                .tags("users", "write", "admin")
                .param(USER_ID)
                .param(ToolProperty.optional("email_address", STRING, "New email address"))
                .param(ToolProperty.optional("real_name", STRING, "New full name"))
                .param(ToolProperty.optional("password", STRING, "New password"))
                .param(ToolProperty.optional("privileged", BOOLEAN, "Privileged access"))
                .param(ToolProperty.optional("disabled", BOOLEAN, "Account disabled"))
                .build(),
            this::updateUser),
        new HandlerTool(
            ToolDefinition.builder("search_users")
                .description("Search users with RT query syntax")
                .tags("users", "search", "basic")
                .readOnly()
                .param(QUERY)
                .param(PAGE)
                .param(PER_PAGE)
                .build(),
            collectionSearch(client, "users")),
        toggle("disable_user", "Disable a user account", "Disabled", true, true),
        toggle("enable_user", "Enable a disabled user account", "Disabled", false, false),
        toggle(
            "grant_privilege", "Grant privileged access to a user", "Privileged", true, false),
        toggle(
            "revoke_privilege",
            "Revoke privileged access from a user",
            "Privileged",
            false,
            false));
  }

  private Tool toggle(
      String name, String description, String field, boolean value, boolean destructive) {
    ToolDefinition.Builder definition =
        ToolDefinition.builder(name).description(description).tags("users", "write", "admin");
    if (destructive) {
      definition.destructive();
    }
    return new HandlerTool(
        definition.param(USER_ID).build(),
        (args, progress) -> {
          Map<String, Object> data = new LinkedHashMap<>();
          data.put(field, flag(value));
          return client.updateUser(args.getString("user_id"), data);
        });
  }

  private Object createUser(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("Name", args.getString("name"));
    data.put("EmailAddress", args.getString("email_address"));
    data.put("Privileged", flag(args.getBoolean("privileged")));
    data.put("Disabled", flag(args.getBoolean("disabled")));
    putIfPresent(data, "RealName", args.getString("real_name"));
    putIfPresent(data, "Password", args.getString("password"));
    return client.createUser(data);
  }

  private Object updateUser(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    putIfPresent(data, "EmailAddress", args.getString("email_address"));
    putIfPresent(data, "RealName", args.getString("real_name"));
    putIfPresent(data, "Password", args.getString("password"));
    putFlagIfPresent(data, "Privileged", args.getBoolean("privileged"));
    putFlagIfPresent(data, "Disabled", args.getBoolean("disabled"));
    return client.updateUser(args.getString("user_id"), data);
  }
}
