package com.gentoro.rtmcp.tools;

import static com.gentoro.rtmcp.tools.CommonParams.PAGE;
import static com.gentoro.rtmcp.tools.CommonParams.PER_PAGE;
import static com.gentoro.rtmcp.tools.CommonParams.QUERY;
import static com.gentoro.rtmcp.tools.CommonParams.collectionSearch;
import static com.gentoro.rtmcp.tools.CommonParams.flag;
import static com.gentoro.rtmcp.tools.CommonParams.putIfPresent;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.IDENTIFIER;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.STRING;

import com.gentoro.rtmcp.client.RtClient;
import com.gentoro.rtmcp.progress.ProgressSink;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class QueueTools implements ToolProvider {
  private static final ToolProperty QUEUE_ID =
      ToolProperty.required("queue_id", IDENTIFIER, "Queue ID or name");

  private final RtClient client;

  public QueueTools(RtClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public List<Tool> tools() {
    return List.of(
        new HandlerTool(
            ToolDefinition.builder("list_queues")
                .description("List all queues in RT")
                .tags("queues", "read", "basic")
                .readOnly()
                .build(),
            (args, progress) -> client.listQueues()),
        new HandlerTool(
            ToolDefinition.builder("get_queue")
                .description("Get queue details by ID or name")
                .tags("queues", "read", "basic")
                .readOnly()
                .param(QUEUE_ID)
                .build(),
            (args, progress) -> client.getQueue(args.getString("queue_id"))),
        new HandlerTool(
            ToolDefinition.builder("create_queue")
                .description("Create a new queue")
                .tags("queues", "write", "admin")
                .param(ToolProperty.required("name", STRING, "Queue name"))
                .param(ToolProperty.optional("description", STRING, "Queue description"))
                .param(
                    ToolProperty.optional(
                        "correspond_address", STRING, "Email address for correspondence"))
                .param(
                    ToolProperty.optional("comment_address", STRING, "Email address for comments"))
                .build(),
            this::createQueue),
        new HandlerTool(
            ToolDefinition.builder("update_queue")
                .description("Update an existing queue")
                .tags("queues", "write", "admin")
                .param(QUEUE_ID)
                .param(ToolProperty.optional("name", STRING, "New queue name"))
                .param(ToolProperty.optional("description", STRING, "New description"))
                .param(
                    ToolProperty.optional(
                        "correspond_address", STRING, "New correspondence address"))
                .param(ToolProperty.optional("comment_address", STRING, "New comment address"))
                .build(),
            this::updateQueue),
        new HandlerTool(
            ToolDefinition.builder("search_queues")
                .description("Search queues with RT query syntax")
                .tags("queues", "search", "basic")
                .readOnly()
                .param(QUERY)
                .param(PAGE)
                .param(PER_PAGE)
                .build(),
            collectionSearch(client, "queues")),
        new HandlerTool(
            ToolDefinition.builder("disable_queue")
                .description("Disable a queue")
                .tags("queues", "write", "admin")
                .destructive()
                .param(QUEUE_ID)
                .build(),
            (args, progress) -> setDisabled(args.getString("queue_id"), true)),
        new HandlerTool(
            ToolDefinition.builder("enable_queue")
                .description("Enable a disabled queue")
                .tags("queues", "write", "admin")
                .param(QUEUE_ID)
                .build(),
            (args, progress) -> setDisabled(args.getString("queue_id"), false)));
  }

  private Object createQueue(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("Name", args.getString("name"));
    putAddresses(data, args);
    return client.createQueue(data);
  }

  private Object updateQueue(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    putIfPresent(data, "Name", args.getString("name"));
    putAddresses(data, args);
    return client.updateQueue(args.getString("queue_id"), data);
  }

  private static void putAddresses(Map<String, Object> data, ToolArguments args) {
    putIfPresent(data, "Description", args.getString("description"));
    putIfPresent(data, "CorrespondAddress", args.getString("correspond_address"));
    putIfPresent(data, "CommentAddress", args.getString("comment_address"));
  }

  private Object setDisabled(String queueId, boolean disabled) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("Disabled", flag(disabled));
    return client.updateQueue(queueId, data);
  }
}
