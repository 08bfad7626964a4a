package com.gentoro.rtmcp.progress;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps per-stage state and turns {@link ProgressSink} calls into {@link ProgressUpdate}s.
 *
 * <p>Intermediate steps go through a {@link ProgressRateLimiter}; begin and end events are always
 * published. Subclasses only decide where an update goes.
 */
public abstract class StagedProgressSink implements ProgressSink {
  private static final String RUNNING = "running";

  private final ProgressRateLimiter limiter;
  private final Map<String, Stage> stages = new HashMap<>();

  protected StagedProgressSink(long minIntervalMs, long minDelta) {
    this.limiter = new ProgressRateLimiter(minIntervalMs, minDelta);
  }

  protected abstract void publish(ProgressUpdate update);

  @Override
  public synchronized void beginStage(String id, String label, long totalWork) {
    Stage stage = new Stage(label == null ? id : label, Math.max(0, totalWork));
    stages.put(id, stage);
    publish(new ProgressUpdate(id, stage.label, 0, stage.total, "begin", RUNNING, Map.of()));
  }

  @Override
  public synchronized void step(
      String id, long completed, String message, Map<String, Object> attrs) {
    if (!limiter.admit(System.currentTimeMillis(), completed)) {
      return;
    }
    Stage stage = stage(id);
    stage.completed = completed;
    publish(new ProgressUpdate(id, stage.label, completed, stage.total, message, RUNNING, attrs));
  }

  @Override
  public synchronized void endStageOk(String id, Map<String, Object> attrs) {
    Stage stage = stages.remove(id);
    if (stage == null) {
      stage = new Stage(id, 0);
    }
    long done = Math.max(stage.total, stage.completed);
    publish(new ProgressUpdate(id, stage.label, done, stage.total, "Complete", "ok", attrs));
  }

  @Override
  public synchronized void endStageError(
      String id, String errorSummary, Map<String, Object> attrs) {
    Stage stage = stages.remove(id);
    if (stage == null) {
      stage = new Stage(id, 0);
    }
    Map<String, Object> merged = new LinkedHashMap<>();
    if (attrs != null) {
      merged.putAll(attrs);
    }
    if (errorSummary != null) {
      merged.put("error", errorSummary);
    }
    publish(
        new ProgressUpdate(
            id, stage.label, stage.completed, stage.total, "error", "error", merged));
  }

  private Stage stage(String id) {
    return stages.computeIfAbsent(id, key -> new Stage(key, 0));
  }

  private static final class Stage {
    final String label;
    final long total;
    long completed;

    Stage(String label, long total) {
      this.label = label;
      this.total = total;
    }
  }
}
