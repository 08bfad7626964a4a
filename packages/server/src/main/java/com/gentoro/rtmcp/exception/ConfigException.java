package com.gentoro.rtmcp.exception;

/** Configuration or environment related problem detected at startup. */
public class ConfigException extends RtMcpException {
  public ConfigException(String message) {
    super(RtErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(RtErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
