package com.gentoro.rtmcp.exception;

import java.util.Map;

/** Authenticated user lacks the right for the operation (HTTP 403). */
public class AuthorizationException extends RtMcpException {
  public AuthorizationException(String message, int status) {
    super(RtErrorCode.PERMISSION_DENIED, message, Map.of("status", status));
  }
}
