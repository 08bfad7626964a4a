package com.gentoro.rtmcp.exception;

/**
 * Canonical error codes for the RT MCP server. Codes are stable and suitable for downstream
 * clients and logs. Prefer the most specific code that reflects the failure origin.
 */
public enum RtErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,

  // Upstream RT responses
  UNAUTHENTICATED,
  PERMISSION_DENIED,
  NOT_FOUND,
  CONFLICT,
  UNPROCESSABLE,
  API_ERROR,

  // Transport, configuration and I/O
  NETWORK_ERROR,
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,
}
