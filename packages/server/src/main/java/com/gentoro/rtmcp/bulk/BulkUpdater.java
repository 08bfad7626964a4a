package com.gentoro.rtmcp.bulk;

import com.gentoro.rtmcp.client.RtClient;
import com.gentoro.rtmcp.exception.ExceptionUtil;
import com.gentoro.rtmcp.exception.RtMcpException;
import com.gentoro.rtmcp.progress.ProgressSink;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies one update payload to many objects of the same type.
 *
 * <p>Objects are updated sequentially in input order. A failing object never stops the run: its
 * error is logged, recorded as an {@link ItemOutcome} failure and the next object is processed.
 * Duplicate identifiers are processed once per occurrence.
 */
public class BulkUpdater {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(BulkUpdater.class);

  static final String STAGE = "bulk-update";

  private final RtClient client;

  public BulkUpdater(RtClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  public BulkUpdateResult update(
      BulkTarget target, List<Long> ids, Map<String, Object> updates, ProgressSink progress) {
    int total = ids.size();
    log.info("Starting bulk update of {} {}s", total, target.wireName());
    progress.beginStage(STAGE, "Updating %d %ss".formatted(total, target.wireName()), total);

    List<ItemOutcome> outcomes = new ArrayList<>(total);
    for (int i = 0; i < total; i++) {
      long id = ids.get(i);
      progress.step(
          STAGE, i, "Updating %s %d".formatted(target.wireName(), id), Map.of("objectId", id));
      outcomes.add(updateOne(target, id, updates));
    }

    BulkUpdateResult result = BulkUpdateResult.of(outcomes);
    progress.endStageOk(
        STAGE, Map.of("success", result.successCount(), "failed", result.failedCount()));
    log.info(
        "Bulk update complete: {} success, {} failed", result.successCount(), result.failedCount());
    return result;
  }

  private ItemOutcome updateOne(BulkTarget target, long id, Map<String, Object> updates) {
    try {
      target.apply(client, id, updates);
      log.debug("Updated {} {}", target.wireName(), id);
      return ItemOutcome.success(id);
    } catch (RtMcpException e) {
      log.warn("Failed to update {} {}: {}", target.wireName(), id, e.getMessage());
      return ItemOutcome.failure(id, ExceptionUtil.describe(e));
    } catch (RuntimeException e) {
      log.error("Unexpected failure updating {} {}", target.wireName(), id, e);
      return ItemOutcome.failure(id, ExceptionUtil.describe(e));
    }
  }
}
