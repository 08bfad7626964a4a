package com.gentoro.rtmcp.exception;

import java.util.Map;

/** RT refused the request payload (HTTP 422). */
public class ValidationException extends RtMcpException {
  public ValidationException(String message, int status) {
    super(RtErrorCode.UNPROCESSABLE, message, Map.of("status", status));
  }
}
