package com.gentoro.rtmcp.tools;

import static com.gentoro.rtmcp.tools.CommonParams.PAGE;
import static com.gentoro.rtmcp.tools.CommonParams.PER_PAGE;
import static com.gentoro.rtmcp.tools.CommonParams.QUERY;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.INTEGER;

import com.gentoro.rtmcp.client.RtClient;
import java.util.List;
import java.util.Objects;

/** Read-only access to the transaction log. */
public class TransactionTools implements ToolProvider {
  private final RtClient client;

  public TransactionTools(RtClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public List<Tool> tools() {
    return List.of(
        new HandlerTool(
            ToolDefinition.builder("get_transaction")
                .description("Get transaction details by ID")
                .tags("transactions", "read", "basic")
                .readOnly()
                .param(ToolProperty.required("transaction_id", INTEGER, "Numeric transaction ID"))
                .build(),
            (args, progress) -> client.getTransaction(args.getLong("transaction_id"))),
        new HandlerTool(
            ToolDefinition.builder("list_transactions")
                .description("List all transactions")
                .tags("transactions", "read", "basic")
                .readOnly()
                .build(),
            (args, progress) -> client.listTransactions()),
        new HandlerTool(
            ToolDefinition.builder("search_transactions")
                .description("Search transactions with RT query syntax")
                .tags("transactions", "search", "basic")
                .readOnly()
                .param(QUERY)
                .param(PAGE)
                .param(PER_PAGE)
                .build(),
            (args, progress) ->
                client.searchTransactions(
                    args.getString("query"), args.getInt("page"), args.getInt("per_page"))));
  }
}
