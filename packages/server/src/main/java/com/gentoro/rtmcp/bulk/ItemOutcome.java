package com.gentoro.rtmcp.bulk;

/** Result of applying a bulk update to one object. {@code error} is set only on failure. */
public record ItemOutcome(long id, boolean success, String error) {

  public static ItemOutcome success(long id) {
    return new ItemOutcome(id, true, null);
  }

  public static ItemOutcome failure(long id, String error) {
    return new ItemOutcome(id, false, error);
  }
}
