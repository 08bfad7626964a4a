package com.gentoro.rtmcp.exception;

import java.util.Map;

/** RT rejected the credentials (HTTP 401). */
public class AuthenticationException extends RtMcpException {
  public AuthenticationException(String message, int status) {
    super(RtErrorCode.UNAUTHENTICATED, message, Map.of("status", status));
  }
}
