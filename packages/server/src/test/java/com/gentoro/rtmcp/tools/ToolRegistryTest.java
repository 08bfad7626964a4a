package com.gentoro.rtmcp.tools;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import com.gentoro.rtmcp.client.RtClient;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ToolRegistryTest {

  private final ToolRegistry registry = ToolRegistry.standard(mock(RtClient.class));

  @Test
  void standardRegistryExposesEveryGroup() {
    assertEquals(72, registry.size());
    for (String name :
        List.of(
            "create_ticket",
            "update_ticket",
            "list_queues",
            "disable_user",
            "add_group_member",
            "create_asset",
            "delete_catalog",
            "get_custom_field",
            "update_custom_role",
            "search_transactions",
            "upload_attachment",
            "search_all",
            "bulk_update",
            "advanced_ticket_search")) {
      assertTrue(registry.find(name).isPresent(), "missing tool " + name);
    }
    assertTrue(registry.find("no_such_tool").isEmpty());
  }

  @Test
  void everyToolIsDescribedAndTagged() {
    Set<String> names = new HashSet<>();
    for (Tool tool : registry.all()) {
      assertTrue(names.add(tool.name()));
      assertFalse(tool.definition().description().isBlank(), tool.name());
      assertFalse(tool.definition().tags().isEmpty(), tool.name());
    }
  }

  @Test
  void readOnlyToolsAreNeverDestructive() {
    for (Tool tool : registry.all()) {
      ToolDefinition definition = tool.definition();
      assertFalse(definition.readOnly() && definition.destructive(), definition.name());
    }
    assertTrue(registry.find("delete_ticket").orElseThrow().definition().destructive());
    assertTrue(registry.find("get_ticket").orElseThrow().definition().readOnly());
  }

  @Test
  void duplicateNamesAreRejected() {
    RtClient client = mock(RtClient.class);
    IllegalStateException e =
        assertThrows(
            IllegalStateException.class,
            () -> new ToolRegistry(List.of(new TicketTools(client), new TicketTools(client))));
    assertEquals("Duplicate tool name: create_ticket", e.getMessage());
  }
}
