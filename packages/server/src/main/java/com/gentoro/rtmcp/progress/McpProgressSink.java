package com.gentoro.rtmcp.progress;

import com.gentoro.rtmcp.utility.JacksonUtility;
import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.Objects;

/**
 * Streams stage updates to the calling MCP session as {@code notifications/progress}, keyed by the
 * progress token the client sent with the tool call.
 */
public class McpProgressSink extends StagedProgressSink {
  private final org.slf4j.Logger log;
  private final McpSyncServerExchange exchange;
  private final String progressToken;

  public McpProgressSink(
      org.slf4j.Logger logger,
      long minIntervalMs,
      long minDelta,
      McpSyncServerExchange exchange,
      Object progressToken) {
    super(minIntervalMs, minDelta);
    this.log = Objects.requireNonNull(logger, "logger");
    this.exchange = Objects.requireNonNull(exchange, "exchange");
    this.progressToken = String.valueOf(Objects.requireNonNull(progressToken, "progressToken"));
  }

  @Override
  protected void publish(ProgressUpdate update) {
    if (log.isDebugEnabled()) {
      log.debug("[progress {}] {}", progressToken, JacksonUtility.toCompactJson(update.toMap()));
    }
    exchange.progressNotification(
        new McpSchema.ProgressNotification(
            progressToken,
            (double) update.completed(),
            (double) update.total(),
            update.message(),
            update.toMap()));
  }
}
