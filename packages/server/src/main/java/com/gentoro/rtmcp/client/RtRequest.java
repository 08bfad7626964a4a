package com.gentoro.rtmcp.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of one call against the RT REST2 API.
 *
 * <p>The path is kept as a list of raw segments relative to the configured base URL; each segment
 * is percent-encoded when the URL is built, so identifiers containing {@code /} or spaces stay
 * within their segment. An empty segment list addresses the base URL itself.
 */
public final class RtRequest {
  private final HttpMethod method;
  private final List<String> pathSegments;
  private final Map<String, Object> body;
  private final Map<String, String> headers;
  private final Map<String, String> query;

  private RtRequest(Builder b) {
    this.method = Objects.requireNonNull(b.method, "method");
    this.pathSegments = Collections.unmodifiableList(new ArrayList<>(b.pathSegments));
    this.body = b.body == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(b.body));
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
    this.query = Collections.unmodifiableMap(new LinkedHashMap<>(b.query));
  }

  public static Builder get(Object... segments) {
    return new Builder(HttpMethod.GET).path(segments);
  }

  public static Builder post(Object... segments) {
    return new Builder(HttpMethod.POST).path(segments);
  }

  public static Builder put(Object... segments) {
    return new Builder(HttpMethod.PUT).path(segments);
  }

  public static Builder delete(Object... segments) {
    return new Builder(HttpMethod.DELETE).path(segments);
  }

  public HttpMethod method() {
    return method;
  }

  public List<String> pathSegments() {
    return pathSegments;
  }

  /** JSON body, or {@code null} when the request carries none. */
  public Map<String, Object> body() {
    return body;
  }

  public Map<String, String> headers() {
    return headers;
  }

  public Map<String, String> query() {
    return query;
  }

  /** Path relative to the base URL, for logging. */
  public String path() {
    return "/" + String.join("/", pathSegments);
  }

  @Override
  public String toString() {
    return method + " " + path() + (query.isEmpty() ? "" : " " + query);
  }

  public static final class Builder {
    private final HttpMethod method;
    private final List<String> pathSegments = new ArrayList<>();
    private Map<String, Object> body;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private final Map<String, String> query = new LinkedHashMap<>();

    private Builder(HttpMethod method) {
      this.method = method;
    }

    public Builder path(Object... segments) {
      for (Object segment : segments) {
        pathSegments.add(String.valueOf(Objects.requireNonNull(segment, "path segment")));
      }
      return this;
    }

    public Builder body(Map<String, Object> body) {
      this.body = body;
      return this;
    }

    /** Adds a header; a {@code null} or blank value is ignored. */
    public Builder header(String name, String value) {
      if (value != null && !value.isBlank()) {
        headers.put(name, value);
      }
      return this;
    }

    /** Adds a query parameter; a {@code null} value is ignored. */
    public Builder query(String name, Object value) {
      if (value != null) {
        query.put(name, String.valueOf(value));
      }
      return this;
    }

    public RtRequest build() {
      return new RtRequest(this);
    }
  }
}
