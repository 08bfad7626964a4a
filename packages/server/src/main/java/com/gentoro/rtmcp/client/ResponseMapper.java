package com.gentoro.rtmcp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.rtmcp.exception.ApiException;
import com.gentoro.rtmcp.exception.AuthenticationException;
import com.gentoro.rtmcp.exception.AuthorizationException;
import com.gentoro.rtmcp.exception.ConflictException;
import com.gentoro.rtmcp.exception.NotFoundException;
import com.gentoro.rtmcp.exception.ValidationException;
import com.gentoro.rtmcp.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Translates an HTTP status and raw response text into either a result map or a typed exception.
 *
 * <ul>
 *   <li>2xx (other than 304): the parsed JSON object
 *   <li>304: {@code {"_status": "not_modified"}}
 *   <li>401, 403, 404, 409/412, 422: the matching typed exception
 *   <li>anything else: {@link ApiException}
 * </ul>
 *
 * A body that is not JSON is carried as {@code {"message": <raw>}}; a JSON value that is not an
 * object is carried as {@code {"value": <parsed>}}.
 */
public final class ResponseMapper {
  public static final String NOT_MODIFIED_KEY = "_status";
  public static final String NOT_MODIFIED_VALUE = "not_modified";

  private ResponseMapper() {}

  public static Map<String, Object> map(int status, String raw) {
    if (status == 304) {
      Map<String, Object> notModified = new LinkedHashMap<>();
      notModified.put(NOT_MODIFIED_KEY, NOT_MODIFIED_VALUE);
      return notModified;
    }

    Map<String, Object> data = parseBody(raw);
    if (status >= 200 && status < 300) {
      return data;
    }

    switch (status) {
      case 401:
        throw new AuthenticationException("Authentication failed: " + message(data, ""), status);
      case 403:
        throw new AuthorizationException("Permission denied: " + message(data, ""), status);
      case 404:
        throw new NotFoundException("Resource not found: " + message(data, ""), status);
      case 409:
      case 412:
        throw new ConflictException("Conflict: " + message(data, ""), status);
      case 422:
        throw new ValidationException("Validation error: " + message(data, ""), status);
      default:
        throw new ApiException(status, message(data, "Unknown error"), data);
    }
  }

  static Map<String, Object> parseBody(String raw) {
    String text = raw == null ? "" : raw;
    Optional<JsonNode> node = JacksonUtility.tryParse(text);

    Map<String, Object> data = new LinkedHashMap<>();
    if (node.isEmpty()) {
      data.put("message", text);
    } else if (node.get().isObject()) {
      data.putAll(JacksonUtility.convertToMap(node.get()));
    } else {
      data.put("value", JacksonUtility.convert(node.get(), Object.class));
    }
    return data;
  }

  private static String message(Map<String, Object> data, String fallback) {
    Object message = data.get("message");
    return message == null ? fallback : String.valueOf(message);
  }
}
