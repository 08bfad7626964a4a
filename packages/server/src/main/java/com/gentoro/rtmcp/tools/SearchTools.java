package com.gentoro.rtmcp.tools;

import static com.gentoro.rtmcp.tools.CommonParams.PAGE;
import static com.gentoro.rtmcp.tools.CommonParams.PER_PAGE;
import static com.gentoro.rtmcp.tools.CommonParams.QUERY;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.INTEGER;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.OBJECT;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.STRING;

import com.gentoro.rtmcp.bulk.BulkSearch;
import com.gentoro.rtmcp.bulk.BulkTarget;
import com.gentoro.rtmcp.bulk.BulkUpdater;
import com.gentoro.rtmcp.client.RtClient;
import com.gentoro.rtmcp.progress.ProgressSink;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Global search plus the long-running bulk tools, which report progress. */
public class SearchTools implements ToolProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(SearchTools.class);

  private final RtClient client;
  private final BulkSearch ticketSearch;
  private final BulkUpdater updater;

  public SearchTools(RtClient client) {
    this.client = Objects.requireNonNull(client, "client");
    this.ticketSearch = BulkSearch.tickets(client);
    this.updater = new BulkUpdater(client);
  }

  @Override
  public List<Tool> tools() {
    return List.of(
        new HandlerTool(
            ToolDefinition.builder("search_all")
                .description(
                    "Search across all RT object types (tickets, queues, users, assets, etc.)")
                .tags("search", "read", "power-user")
                .readOnly()
                .param(QUERY)
                .param(
                    ToolProperty.optional(
                        "object_type",
                        STRING,
                        "Optional object type filter (ticket, queue, user, asset, etc.)"))
                .param(PAGE)
                .param(PER_PAGE)
                .build(),
            this::searchAll),
        new HandlerTool(
            ToolDefinition.builder("bulk_update")
                .description("Update multiple objects with progress reporting")
                .tags("search", "write", "power-user")
                .param(
                    ToolProperty.required("object_type", STRING, "Type of object to update")
                        .withAllowedValues(BulkTarget.wireNames()))
                .param(
                    ToolProperty.arrayOf("object_ids", INTEGER, "IDs of objects to update", true))
                .param(ToolProperty.required("updates", OBJECT, "Fields to set on every object"))
                .build(),
            this::bulkUpdate),
        new HandlerTool(
            ToolDefinition.builder("advanced_ticket_search")
                .description(
                    "Advanced ticket search with automatic pagination to retrieve all results")
                .tags("search", "read", "power-user")
                .readOnly()
                .param(QUERY)
                .param(
                    ToolProperty.optional(
                            "max_results", INTEGER, "Maximum total results to retrieve")
                        .withDefault(BulkSearch.DEFAULT_MAX_RESULTS))
                .build(),
            this::advancedTicketSearch));
  }

  private Object searchAll(ToolArguments args, ProgressSink progress) {
    Map<String, Object> results =
        client.searchAll(
            args.getString("query"),
            args.getString("object_type"),
            args.getInt("page"),
            args.getInt("per_page"));
    log.info(
        "Global search found {} results, showing {} on page {}",
        results.getOrDefault("total", 0),
        results.getOrDefault("count", 0),
        args.getInt("page"));
    return results;
  }

  private Object advancedTicketSearch(ToolArguments args, ProgressSink progress) {
    return ticketSearch.search(args.getString("query"), args.getInt("max_results"), progress);
  }

  private Object bulkUpdate(ToolArguments args, ProgressSink progress) {
    BulkTarget target = BulkTarget.fromWireName(args.getString("object_type"));
    List<Long> ids = args.getList("object_ids");
    return updater.update(target, ids, args.getMap("updates"), progress);
  }
}
