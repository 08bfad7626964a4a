package com.gentoro.rtmcp.tools;

import java.util.List;

/** A group of related tools sharing one RT client. */
public interface ToolProvider {
  List<Tool> tools();
}
