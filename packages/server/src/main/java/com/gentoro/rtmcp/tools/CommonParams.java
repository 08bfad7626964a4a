package com.gentoro.rtmcp.tools;

import static com.gentoro.rtmcp.tools.ToolProperty.Type.INTEGER;
import static com.gentoro.rtmcp.tools.ToolProperty.Type.STRING;

import com.gentoro.rtmcp.client.RtClient;
import java.util.Map;

/** Parameters and payload helpers shared by the tool groups. */
final class CommonParams {
  static final ToolProperty QUERY = ToolProperty.required("query", STRING, "RT query string");
  static final ToolProperty PAGE =
      ToolProperty.optional("page", INTEGER, "Page number (1-indexed)").withDefault(1);
  static final ToolProperty PER_PAGE =
      ToolProperty.optional("per_page", INTEGER, "Items per page (max 100)").withDefault(20);

  private CommonParams() {}

  /** Handler for {@code GET /<collection>?query&page&per_page}. */
  static ToolHandler collectionSearch(RtClient client, String collection) {
    return (args, progress) ->
        client.searchCollection(
            collection, args.getString("query"), args.getInt("page"), args.getInt("per_page"));
  }

  /** Put {@code value} under {@code key} unless it is null. */
  static void putIfPresent(Map<String, Object> payload, String key, Object value) {
    if (value != null) {
      payload.put(key, value);
    }
  }

  /** RT encodes boolean flags as 1/0. */
  static int flag(boolean value) {
    return value ? 1 : 0;
  }

  static void putFlagIfPresent(Map<String, Object> payload, String key, Boolean value) {
    if (value != null) {
      payload.put(key, flag(value));
    }
  }
}
