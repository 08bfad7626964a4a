package com.gentoro.rtmcp.tools;

import static com.gentoro.rtmcp.tools.CommonParams.PAGE;
import static com.gentoro.rtmcp.tools.CommonParams.PER_PAGE;
import static com.gentoro.rtmcp.tools.CommonParams.QUERY;
import static com.gentoro.rtmcp.tools.CommonParams.putIfPresent;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.INTEGER;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.STRING;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.STRING_OR_LIST;

import com.gentoro.rtmcp.client.RtClient;
import com.gentoro.rtmcp.progress.ProgressSink;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Ticket lifecycle: create, read, update, reply, ownership, merge and links. */
public class TicketTools implements ToolProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(TicketTools.class);

  private static final ToolProperty TICKET_ID =
      ToolProperty.required("ticket_id", INTEGER, "Numeric ticket ID");

  private final RtClient client;

  public TicketTools(RtClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public List<Tool> tools() {
    return List.of(
        new HandlerTool(
            ToolDefinition.builder("create_ticket")
                .description("Create a new ticket in Request Tracker")
                .tags("tickets", "write", "basic")
                .param(ToolProperty.required("queue", STRING, "Queue name or ID"))
                .param(ToolProperty.required("subject", STRING, "Ticket subject line"))
                .param(ToolProperty.optional("requestor", STRING, "Requestor email address"))
                .param(ToolProperty.optional("content", STRING, "Initial ticket content"))
                .param(ToolProperty.optional("priority", INTEGER, "Ticket priority").withDefault(0))
                .param(ToolProperty.optional("status", STRING, "Initial status").withDefault("new"))
                .build(),
            this::createTicket),
        new HandlerTool(
            ToolDefinition.builder("get_ticket")
                .description("Get ticket details by ID")
                .tags("tickets", "read", "basic")
                .readOnly()
                .param(TICKET_ID)
                .build(),
            (args, progress) -> client.getTicket(args.getLong("ticket_id"))),
        new HandlerTool(
            ToolDefinition.builder("update_ticket")
                .description("Update an existing ticket")
                .tags("tickets", "write", "basic")
                .param(TICKET_ID)
                .param(ToolProperty.optional("subject", STRING, "New subject"))
                .param(ToolProperty.optional("status", STRING, "New status"))
                .param(ToolProperty.optional("priority", INTEGER, "New priority"))
                .param(ToolProperty.optional("owner", STRING, "New owner username"))
                .param(
                    ToolProperty.optional(
                        "etag", STRING, "ETag of the ticket as last read, sent as If-Match"))
                .build(),
            this::updateTicket),
        new HandlerTool(
            ToolDefinition.builder("delete_ticket")
                .description("Delete (disable) a ticket")
                .tags("tickets", "delete", "admin")
                .destructive()
                .param(TICKET_ID)
                .build(),
            (args, progress) -> client.deleteTicket(args.getLong("ticket_id"))),
        new HandlerTool(
            ToolDefinition.builder("search_tickets")
                .description("Search tickets with RT query syntax")
                .tags("tickets", "search", "basic")
                .readOnly()
                .param(QUERY)
                .param(PAGE)
                .param(PER_PAGE)
                .build(),
            this::searchTickets),
        new HandlerTool(
            ToolDefinition.builder("correspond_ticket")
                .description("Add correspondence (customer-visible reply) to a ticket")
                .tags("tickets", "write", "basic")
                .param(TICKET_ID)
                .param(ToolProperty.required("content", STRING, "Message content"))
                .param(ToolProperty.optional("cc", STRING_OR_LIST, "CC recipients"))
                .param(ToolProperty.optional("bcc", STRING_OR_LIST, "BCC recipients"))
                .build(),
            this::correspond),
        new HandlerTool(
            ToolDefinition.builder("comment_ticket")
                .description("Add internal comment (not visible to customer) to a ticket")
                .tags("tickets", "write", "basic")
                .param(TICKET_ID)
                .param(ToolProperty.required("content", STRING, "Comment content"))
                .build(),
            this::comment),
        new HandlerTool(
            ToolDefinition.builder("take_ticket")
                .description("Take ownership of a ticket")
                .tags("tickets", "write", "basic")
                .param(TICKET_ID)
                .build(),
            (args, progress) -> client.takeTicket(args.getLong("ticket_id"))),
        new HandlerTool(
            ToolDefinition.builder("steal_ticket")
                .description("Steal ownership of a ticket from another user")
                .tags("tickets", "write", "power-user")
                .param(TICKET_ID)
                .build(),
            (args, progress) -> client.stealTicket(args.getLong("ticket_id"))),
        new HandlerTool(
            ToolDefinition.builder("untake_ticket")
                .description("Release ownership of a ticket (set owner to Nobody)")
                .tags("tickets", "write", "basic")
                .param(TICKET_ID)
                .build(),
            (args, progress) -> client.untakeTicket(args.getLong("ticket_id"))),
        new HandlerTool(
            ToolDefinition.builder("merge_tickets")
                .description("Merge one ticket into another")
                .tags("tickets", "write", "power-user")
                .destructive()
                .param(ToolProperty.required("ticket_id", INTEGER, "Ticket to merge"))
                .param(
                    ToolProperty.required("into_ticket_id", INTEGER, "Ticket to merge into"))
                .build(),
            (args, progress) ->
                client.mergeTickets(args.getLong("ticket_id"), args.getLong("into_ticket_id"))),
        new HandlerTool(
            ToolDefinition.builder("get_ticket_history")
                .description("Get transaction history for a ticket")
                .tags("tickets", "read", "basic")
                .readOnly()
                .param(TICKET_ID)
                .build(),
            (args, progress) -> client.getTicketHistory(args.getLong("ticket_id"))),
        new HandlerTool(
            ToolDefinition.builder("get_ticket_attachments")
                .description("Get attachments for a ticket")
                .tags("tickets", "read", "basic")
                .readOnly()
                .param(TICKET_ID)
                .build(),
            (args, progress) -> client.getTicketAttachments(args.getLong("ticket_id"))),
        new HandlerTool(
            ToolDefinition.builder("link_tickets")
                .description("Create links between tickets")
                .tags("tickets", "write", "power-user")
                .param(ToolProperty.required("ticket_id", INTEGER, "Source ticket ID"))
                .param(
                    ToolProperty.required(
                        "link_type",
                        STRING,
                        "Link type (DependsOn, DependedOnBy, RefersTo, ReferredToBy, etc.)"))
                .param(ToolProperty.required("target_ticket_id", INTEGER, "Target ticket ID"))
                .build(),
            this::link));
  }

  private Object createTicket(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("Queue", args.getString("queue"));
    data.put("Subject", args.getString("subject"));
    data.put("Priority", args.getLong("priority"));
    data.put("Status", args.getString("status"));
    putIfPresent(data, "Requestor", args.getString("requestor"));
    putIfPresent(data, "Content", args.getString("content"));
    Map<String, Object> result = client.createTicket(data);
    log.info("Created ticket {} in queue {}", result.get("id"), args.getString("queue"));
    return result;
  }

  private Object updateTicket(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    putIfPresent(data, "Subject", args.getString("subject"));
    putIfPresent(data, "Status", args.getString("status"));
    putIfPresent(data, "Priority", args.getLong("priority"));
    putIfPresent(data, "Owner", args.getString("owner"));
    return client.updateTicket(args.getLong("ticket_id"), data, args.getString("etag"));
  }

  private Object searchTickets(ToolArguments args, ProgressSink progress) {
    Map<String, Object> results =
        client.searchTickets(args.getString("query"), args.getInt("page"), args.getInt("per_page"));
    log.info("Ticket search matched {} (page {})", results.get("total"), args.getInt("page"));
    return results;
  }

  private Object correspond(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("Content", args.getString("content"));
    putIfPresent(data, "Cc", args.getStringOrList("cc"));
    putIfPresent(data, "Bcc", args.getStringOrList("bcc"));
    return client.correspondTicket(args.getLong("ticket_id"), data);
  }

  private Object comment(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("Content", args.getString("content"));
    return client.commentTicket(args.getLong("ticket_id"), data);
  }

  private Object link(ToolArguments args, ProgressSink progress) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put(args.getString("link_type"), args.getLong("target_ticket_id"));
    return client.linkTickets(args.getLong("ticket_id"), data);
  }
}
