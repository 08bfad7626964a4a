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

public class CustomFieldTools implements ToolProvider {
  private static final ToolProperty FIELD_ID =
      ToolProperty.required("field_id", IDENTIFIER, "Custom field ID or name");

  private final RtClient client;

  public CustomFieldTools(RtClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public List<Tool> tools() {
    return List.of(
        new HandlerTool(
            ToolDefinition.builder("list_custom_fields")
                .description("List all custom fields in RT")
                .tags("custom-fields", "read", "basic")
                .readOnly()
                .build(),
            (args, progress) -> client.listCustomFields()),
        new HandlerTool(
            ToolDefinition.builder("get_custom_field")
                .description("Get custom field details by ID or name")
                .tags("custom-fields", "read", "basic")
                .readOnly()
                .param(FIELD_ID)
                .build(),
            (args, progress) -> client.getCustomField(args.getString("field_id"))),
        new HandlerTool(
            ToolDefinition.builder("create_custom_field")
                .description("Create a new custom field")
                .tags("custom-fields", "write", "admin")
                .param(ToolProperty.required("name", STRING, "Custom field name"))
                .param(
                    ToolProperty.required(
                        "type", STRING, "Field type (Freeform, Select, Text, Date, etc.)"))
                .param(ToolProperty.optional("description", STRING, "Field description"))
                .param(
                    ToolProperty.optional(
                        "lookup_type", STRING, "Object type the field applies to"))
                .build(),
            this::createField),
        new HandlerTool(
            ToolDefinition.builder("update_custom_field")
                .description("Update an existing custom field")
                .tags("custom-fields", "write", "admin")
                .param(FIELD_ID)
                .param(ToolProperty.optional("name", STRING, "New field name"))
                .param(ToolProperty.optional("description", STRING, "New description"))
                .build(),
            this::updateField),
        new HandlerTool(
            ToolDefinition.builder("delete_custom_field")
                .description("Delete a custom field")
                .tags("custom-fields", "delete", "admin")
                .destructive()
                .param(FIELD_ID)
                .build(),
            (args, progress) -> client.deleteCustomField(args.getString("field_id"))),
        new HandlerTool(
            ToolDefinition.builder("search_custom_fields")
                .description("Search custom fields with RT query syntax")
                .tags("custom-fields", "search", "basic")
                .readOnly()
                .param(QUERY)
                .param(PAGE)
                .param(PER_PAGE)
                .build(),
            collectionSearch(client, "customfields")));
  }

  private Object createField(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("Name", args.getString("name"));
    data.put("Type", args.getString("type"));
    putIfPresent(data, "Description", args.getString("description"));
    putIfPresent(data, "LookupType", args.getString("lookup_type"));
    return client.createCustomField(data);
  }

  private Object updateField(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    putIfPresent(data, "Name", args.getString("name"));
    putIfPresent(data, "Description", args.getString("description"));
    return client.updateCustomField(args.getString("field_id"), data);
  }
}
