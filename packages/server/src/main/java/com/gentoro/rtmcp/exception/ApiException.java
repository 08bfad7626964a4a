package com.gentoro.rtmcp.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Any non-success RT response without a more specific mapping. Keeps the numeric status, the
 * message extracted from the body and the raw body for diagnostics.
 */
public class ApiException extends RtMcpException {
  private final int statusCode;
  private final String apiMessage;
  private final Map<String, Object> responseBody;

  public ApiException(int statusCode, String apiMessage, Map<String, Object> responseBody) {
    super(
        RtErrorCode.API_ERROR,
        "RT API Error " + statusCode + ": " + apiMessage,
        Map.of("status", statusCode));
    this.statusCode = statusCode;
    this.apiMessage = apiMessage;
    this.responseBody =
        responseBody == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(responseBody));
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getApiMessage() {
    return apiMessage;
  }

  public Map<String, Object> getResponseBody() {
    return responseBody;
  }
}
