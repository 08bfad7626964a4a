package com.gentoro.rtmcp.exception;

import java.util.Map;

/** Optimistic-concurrency violation, e.g. a stale {@code If-Match} token (HTTP 409 or 412). */
public class ConflictException extends RtMcpException {
  public ConflictException(String message, int status) {
    super(RtErrorCode.CONFLICT, message, Map.of("status", status));
  }
}
