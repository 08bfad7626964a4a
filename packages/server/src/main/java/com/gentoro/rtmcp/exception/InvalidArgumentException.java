package com.gentoro.rtmcp.exception;

/** Tool arguments that do not match the declared parameter schema. */
public class InvalidArgumentException extends RtMcpException {
  public InvalidArgumentException(String message) {
    super(RtErrorCode.INVALID_ARGUMENT, message);
  }

  public InvalidArgumentException(String message, Throwable cause) {
    super(RtErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
