package com.gentoro.rtmcp.exception;

/** Failure converting values to or from JSON/YAML. */
public class SerializationException extends RtMcpException {
  public SerializationException(String message) {
    super(RtErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(RtErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
