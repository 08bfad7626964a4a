package com.gentoro.rtmcp.progress;

import java.util.Map;

/**
 * Receives progress of long tool calls: paged searches report one step per page and bulk updates
 * one step per object. A stage is opened with {@link #beginStage} and closed by exactly one of
 * {@link #endStageOk} or {@link #endStageError}.
 */
public interface ProgressSink {

  /**
   * @param id stage identifier, e.g. {@code bulk-update}
   * @param label text shown to the client
   * @param totalWork expected units of work; 0 when unknown
   */
  void beginStage(String id, String label, long totalWork);

  /**
   * @param completed units done so far within the stage
   * @param attrs extra fields such as {@code page} or {@code objectId}; may be null
   */
  void step(String id, long completed, String message, Map<String, Object> attrs);

  void endStageOk(String id, Map<String, Object> attrs);

  void endStageError(String id, String errorSummary, Map<String, Object> attrs);
}
