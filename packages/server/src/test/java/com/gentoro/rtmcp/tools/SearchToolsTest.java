package com.gentoro.rtmcp.tools;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.gentoro.rtmcp.bulk.BulkSearchResult;
import com.gentoro.rtmcp.bulk.BulkUpdateResult;
import com.gentoro.rtmcp.client.RtClient;
import com.gentoro.rtmcp.exception.ConflictException;
import com.gentoro.rtmcp.exception.InvalidArgumentException;
import com.gentoro.rtmcp.progress.NoOpProgressSink;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SearchToolsTest {

  @Mock RtClient client;

  private ToolRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new ToolRegistry(List.of(new SearchTools(client)));
  }

  private Object call(String tool, Map<String, Object> args) {
    return registry.find(tool).orElseThrow().execute(args, NoOpProgressSink.INSTANCE);
  }

  @Test
  void globalSearchPassesOptionalType() {
    when(client.searchAll("printer", "asset", 1, 20)).thenReturn(Map.of("total", 3));

    assertEquals(
        Map.of("total", 3), call("search_all", Map.of("query", "printer", "object_type", "asset")));
  }

  @Test
  void advancedSearchPagesThroughTickets() {
    when(client.searchTickets("Status = 'open'", 1, 100))
        .thenReturn(
            Map.of("page", 1, "pages", 2, "total", 101, "items", List.of(Map.of("id", 1))));
    when(client.searchTickets("Status = 'open'", 2, 100))
        .thenReturn(Map.of("page", 2, "pages", 2, "total", 101, "items", List.of(Map.of("id", 2))));

    BulkSearchResult result =
        (BulkSearchResult) call("advanced_ticket_search", Map.of("query", "Status = 'open'"));

    assertEquals(1000, result.maxResults());
    assertEquals(101, result.totalAvailable());
    assertEquals(2, result.retrievedCount());
  }

  @Test
  void bulkUpdateRoutesToTargetType() {
    when(client.updateTicket(eq(1L), anyMap())).thenReturn(Map.of());
    when(client.updateTicket(eq(2L), anyMap()))
        .thenThrow(new ConflictException("Conflict: locked", 409));

    BulkUpdateResult result =
        (BulkUpdateResult)
            call(
                "bulk_update",
                Map.of(
                    "object_type", "ticket",
                    "object_ids", List.of(1, 2),
                    "updates", Map.of("Status", "stalled")));

    assertEquals(List.of(1L), result.results().success());
    assertEquals("Conflict: locked", result.results().failed().get(0).error());
  }

  @Test
  void bulkUpdateRejectsUnknownTypeBeforeAnyCall() {
    InvalidArgumentException e =
        assertThrows(
            InvalidArgumentException.class,
            () ->
                call(
                    "bulk_update",
                    Map.of(
                        "object_type", "widget",
                        "object_ids", List.of(1),
                        "updates", Map.of("Status", "open"))));

    assertTrue(e.getMessage().startsWith("Invalid value for object_type"));
    verifyNoInteractions(client);
  }
}
