package com.gentoro.rtmcp.bulk;

import com.gentoro.rtmcp.client.RtClient;
import com.gentoro.rtmcp.exception.InvalidArgumentException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/** Object types a bulk update can be routed to. */
public enum BulkTarget {
  TICKET("ticket") {
    @Override
    Map<String, Object> apply(RtClient client, long id, Map<String, Object> updates) {
      return client.updateTicket(id, updates);
    }
  },
  ASSET("asset") {
    @Override
    Map<String, Object> apply(RtClient client, long id, Map<String, Object> updates) {
      return client.updateAsset(id, updates);
    }
  },
  QUEUE("queue") {
    @Override
    Map<String, Object> apply(RtClient client, long id, Map<String, Object> updates) {
      return client.updateQueue(String.valueOf(id), updates);
    }
  },
  USER("user") {
    @Override
    Map<String, Object> apply(RtClient client, long id, Map<String, Object> updates) {
      return client.updateUser(String.valueOf(id), updates);
    }
  };

  private final String wireName;

  BulkTarget(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  abstract Map<String, Object> apply(RtClient client, long id, Map<String, Object> updates);

  public static List<String> wireNames() {
    return Arrays.stream(values()).map(BulkTarget::wireName).collect(Collectors.toList());
  }

  public static BulkTarget fromWireName(String name) {
    String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    for (BulkTarget target : values()) {
      if (target.wireName.equals(normalized)) {
        return target;
      }
    }
    throw new InvalidArgumentException(
        "Unsupported object type: %s (expected one of %s)".formatted(name, wireNames()));
  }
}
