package com.gentoro.rtmcp.exception;

import java.util.Map;

/** Requested RT object does not exist (HTTP 404). */
public class NotFoundException extends RtMcpException {
  public NotFoundException(String message, int status) {
    super(RtErrorCode.NOT_FOUND, message, Map.of("status", status));
  }
}
