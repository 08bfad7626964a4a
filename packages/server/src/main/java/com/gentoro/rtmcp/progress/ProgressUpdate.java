package com.gentoro.rtmcp.progress;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One progress event of a stage, as handed to a transport.
 *
 * @param stageId stage identifier, e.g. {@code bulk-search}
 * @param label human-readable stage label
 * @param completed work units done, clamped to {@code total} when the total is known
 * @param total work units expected; 0 when unknown
 * @param message short description of the event
 * @param status one of {@code running}, {@code ok} or {@code error}
 * @param attrs structured attributes such as the page number or the object id
 */
public record ProgressUpdate(
    String stageId,
    String label,
    long completed,
    long total,
    String message,
    String status,
    Map<String, Object> attrs) {

  public ProgressUpdate {
    total = Math.max(0, total);
    completed = Math.max(0, total > 0 ? Math.min(completed, total) : completed);
    attrs = attrs == null ? Map.of() : Map.copyOf(attrs);
  }

  public int percent() {
    if (total == 0) {
      return 0;
    }
    return (int) Math.min(100, Math.round(completed * 100.0 / total));
  }

  /** Key order is stable so log lines stay diffable. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("stageId", stageId);
    map.put("label", label);
    map.put("completed", completed);
    map.put("total", total);
    map.put("percent", percent());
    map.put("message", message);
    map.put("status", status);
    map.put("attrs", attrs);
    return map;
  }
}
