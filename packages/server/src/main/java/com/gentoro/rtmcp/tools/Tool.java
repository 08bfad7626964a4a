package com.gentoro.rtmcp.tools;

import com.gentoro.rtmcp.progress.ProgressSink;
import java.util.Map;

/** A callable operation exposed to MCP clients. */
public interface Tool {

  ToolDefinition definition();

  /**
   * Decode {@code arguments} against the definition and run the operation.
   *
   * @return a JSON-serializable result
   * @throws com.gentoro.rtmcp.exception.RtMcpException on invalid arguments or a failed RT call
   */
  Object execute(Map<String, Object> arguments, ProgressSink progress);

  default String name() {
    return definition().name();
  }
}
