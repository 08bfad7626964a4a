package com.gentoro.rtmcp.exception;

import java.util.Map;

/** Transport-level failure talking to RT: connection refused, DNS, TLS or timeout. */
public class NetworkException extends RtMcpException {
  private final boolean timeout;

  public NetworkException(String message) {
    this(message, false, null);
  }

  public NetworkException(String message, Throwable cause) {
    this(message, false, cause);
  }

  public NetworkException(String message, boolean timeout, Throwable cause) {
    super(RtErrorCode.NETWORK_ERROR, message, Map.of("timeout", timeout), cause);
    this.timeout = timeout;
  }

  /** True when the configured request timeout elapsed without a response. */
  public boolean isTimeout() {
    return timeout;
  }
}
