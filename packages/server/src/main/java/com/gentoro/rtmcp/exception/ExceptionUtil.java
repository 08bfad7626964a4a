package com.gentoro.rtmcp.exception;

import java.util.Arrays;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Helpers for turning exceptions into text for tool results and for wrapping foreign errors. */
public final class ExceptionUtil {
  static final int TRACE_FRAMES = 8;

  private ExceptionUtil() {}

  /**
   * Text of a failure as shown to an MCP client: the message when there is one, otherwise the
   * exception type followed by its top frames, e.g. {@code NullPointerException: a.B.c(B.java:4) <
   * a.D.e(D.java:9)}.
   */
  public static String describe(Throwable t) {
    String message = t.getMessage();
    if (message != null && !message.isBlank()) {
      return message;
    }
    return t.getClass().getSimpleName() + ": " + topFrames(t, TRACE_FRAMES);
  }

  static String topFrames(Throwable t, int frames) {
    return Arrays.stream(t.getStackTrace())
        .limit(frames)
        .map(StackTraceElement::toString)
        .collect(Collectors.joining(" < "));
  }

  /**
   * Return {@code t} unchanged when it already belongs to the RT MCP taxonomy, otherwise the
   * exception built by {@code wrapper}. Meant for {@code throw ExceptionUtil.wrap(e, ...)}.
   */
  public static RtMcpException wrap(Throwable t, Function<Throwable, RtMcpException> wrapper) {
    if (t instanceof RtMcpException ex) {
      return ex;
    }
    return wrapper.apply(t);
  }
}
