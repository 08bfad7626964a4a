package com.gentoro.rtmcp.tools;

import com.gentoro.rtmcp.client.RtClient;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Every tool the server exposes, keyed by unique name in registration order. */
public class ToolRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(ToolRegistry.class);

  private final Map<String, Tool> tools = new LinkedHashMap<>();

  public ToolRegistry(List<? extends ToolProvider> providers) {
    for (ToolProvider provider : providers) {
      for (Tool tool : provider.tools()) {
        register(tool);
      }
    }
    log.info("Registered {} tools from {} groups", tools.size(), providers.size());
  }

  /** Registry with every RT tool group bound to {@code client}. */
  public static ToolRegistry standard(RtClient client) {
    return new ToolRegistry(
        List.of(
            new TicketTools(client),
            new QueueTools(client),
            new UserTools(client),
            new GroupTools(client),
            new AssetTools(client),
            new CatalogTools(client),
            new CustomFieldTools(client),
            new CustomRoleTools(client),
            new TransactionTools(client),
            new AttachmentTools(client),
            new SearchTools(client)));
  }

  private void register(Tool tool) {
    Tool previous = tools.putIfAbsent(tool.name(), tool);
    if (previous != null) {
      throw new IllegalStateException("Duplicate tool name: " + tool.name());
    }
  }

  public Optional<Tool> find(String name) {
    return Optional.ofNullable(tools.get(name));
  }

  public List<Tool> all() {
    return Collections.unmodifiableList(new ArrayList<>(tools.values()));
  }

  public int size() {
    return tools.size();
  }
}
