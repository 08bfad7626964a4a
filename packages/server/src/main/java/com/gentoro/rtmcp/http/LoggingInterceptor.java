package com.gentoro.rtmcp.http;

import java.io.IOException;
import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(LoggingInterceptor.class);

  private static final long MAX_LOGGED_BODY = 64 * 1024;

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug(
          "Sending {} {}\nHeaders:\n{}Body:\n{}",
          request.method(),
          request.url(),
          redact(request.headers()),
          bodyToString(request.body()));
    }

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "Received {} for {} {} in {} ms",
        response.code(),
        request.method(),
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d));

    if (log.isTraceEnabled()) {
      ResponseBody peek = response.peekBody(MAX_LOGGED_BODY);
      log.trace("Response body:\n{}", peek.string());
    }
    return response;
  }

  private static String redact(Headers headers) {
    Headers.Builder copy = headers.newBuilder();
    if (headers.get("Authorization") != null) {
      copy.set("Authorization", "<redacted>");
    }
    return copy.build().toString();
  }

  private static String bodyToString(RequestBody body) {
    if (body == null) return "(none)";
    MediaType type = body.contentType();
    if (type == null || !"json".equalsIgnoreCase(type.subtype())) {
      return "(" + (type == null ? "unknown" : type) + " body)";
    }
    try {
      Buffer buffer = new Buffer();
      body.writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
