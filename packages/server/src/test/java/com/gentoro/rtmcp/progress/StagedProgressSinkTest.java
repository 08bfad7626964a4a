package com.gentoro.rtmcp.progress;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StagedProgressSinkTest {

  private static final class Recording extends StagedProgressSink {
    final List<ProgressUpdate> updates = new ArrayList<>();

    Recording(long minIntervalMs, long minDelta) {
      super(minIntervalMs, minDelta);
    }

    @Override
    protected void publish(ProgressUpdate update) {
      updates.add(update);
    }
  }

  @Test
  @DisplayName("begin, steps and end are published with the stage label and total")
  void publishesStageLifecycle() {
    Recording sink = new Recording(0, 0);

    sink.beginStage("bulk-update", "Updating 4 tickets", 4);
    sink.step("bulk-update", 2, "Updated ticket 11", Map.of("objectId", 11L));
    sink.endStageOk("bulk-update", Map.of("succeeded", 4));

    assertEquals(3, sink.updates.size());
    ProgressUpdate begin = sink.updates.get(0);
    assertEquals("running", begin.status());
    assertEquals(0, begin.completed());
    assertEquals(4, begin.total());

    ProgressUpdate step = sink.updates.get(1);
    assertEquals("Updating 4 tickets", step.label());
    assertEquals(50, step.percent());
    assertEquals(11L, step.attrs().get("objectId"));

    ProgressUpdate end = sink.updates.get(2);
    assertEquals("ok", end.status());
    assertEquals(4, end.completed());
    assertEquals(100, end.percent());
  }

  @Test
  @DisplayName("throttled steps are dropped but begin and end always pass")
  void throttlesSteps() {
    Recording sink = new Recording(60_000, 10);

    sink.beginStage("bulk-search", "Searching", 100);
    sink.step("bulk-search", 1, "Page 1", Map.of());
    sink.step("bulk-search", 2, "Page 2", Map.of());
    sink.endStageOk("bulk-search", Map.of());

    assertEquals(
        List.of("begin", "Page 1", "Complete"),
        sink.updates.stream().map(ProgressUpdate::message).toList());
  }

  @Test
  @DisplayName("an error end keeps the last completed count and adds the summary")
  void errorEndCarriesSummary() {
    Recording sink = new Recording(0, 0);

    sink.beginStage("bulk-search", "Searching", 0);
    sink.step("bulk-search", 200, "Page 2", Map.of("page", 2));
    sink.endStageError("bulk-search", "Network error: timeout", Map.of("page", 3));

    ProgressUpdate end = sink.updates.get(2);
    assertEquals("error", end.status());
    assertEquals(200, end.completed());
    assertEquals(0, end.percent());
    assertEquals("Network error: timeout", end.attrs().get("error"));
    assertEquals(3, end.attrs().get("page"));
  }

  @Test
  void toMapUsesStableKeyOrder() {
    ProgressUpdate update = new ProgressUpdate("s", "S", 7, 5, "m", "running", null);

    assertEquals(5, update.completed());
    assertEquals(
        List.of("stageId", "label", "completed", "total", "percent", "message", "status", "attrs"),
        List.copyOf(update.toMap().keySet()));
  }
}
