package com.gentoro.rtmcp.tools;

import com.gentoro.rtmcp.progress.ProgressSink;

/** Body of a tool, invoked with already decoded arguments. */
@FunctionalInterface
public interface ToolHandler {
  Object handle(ToolArguments arguments, ProgressSink progress);
}
