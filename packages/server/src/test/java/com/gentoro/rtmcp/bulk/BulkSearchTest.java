package com.gentoro.rtmcp.bulk;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.rtmcp.exception.NetworkException;
import com.gentoro.rtmcp.progress.NoOpProgressSink;
import com.gentoro.rtmcp.progress.ProgressSink;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BulkSearchTest {

  /** Fake collection of {@code total} tickets served in pages. */
  private static final class FakeTickets implements BulkSearch.PageFetcher {
    private final int total;
    private final List<Integer> requestedPages = new ArrayList<>();

    FakeTickets(int total) {
      this.total = total;
    }

    @Override
    public Map<String, Object> fetch(String query, int page, int perPage) {
      requestedPages.add(page);
      int pages = Math.max(1, (total + perPage - 1) / perPage);
      List<Map<String, Object>> items = new ArrayList<>();
      for (int id = (page - 1) * perPage + 1; id <= Math.min(total, page * perPage); id++) {
        items.add(Map.of("id", id));
      }
      Map<String, Object> response = new LinkedHashMap<>();
      response.put("count", items.size());
      response.put("page", page);
      response.put("pages", pages);
      response.put("per_page", perPage);
      response.put("total", total);
      response.put("items", items);
      return response;
    }
  }

  @Test
  @DisplayName("Stops once max_results is reached and truncates the last page")
  void truncatesToMaxResults() {
    FakeTickets fake = new FakeTickets(250);

    BulkSearchResult result =
        new BulkSearch(fake).search("Status = 'open'", 150, NoOpProgressSink.INSTANCE);

    assertEquals(List.of(1, 2), fake.requestedPages);
    assertEquals(150, result.retrievedCount());
    assertEquals(150, result.items().size());
    assertEquals(250, result.totalAvailable());
    assertEquals(150, result.maxResults());
    assertEquals(150, result.items().get(149).get("id"));
  }

  @Test
  void stopsAtLastPage() {
    FakeTickets fake = new FakeTickets(230);

    BulkSearchResult result = new BulkSearch(fake).search("q", 1000, NoOpProgressSink.INSTANCE);

    assertEquals(List.of(1, 2, 3), fake.requestedPages);
    assertEquals(230, result.retrievedCount());
    assertEquals(230, result.totalAvailable());
  }

  @Test
  void emptyResultFetchesOnePage() {
    FakeTickets fake = new FakeTickets(0);

    BulkSearchResult result = new BulkSearch(fake).search("q", 10, NoOpProgressSink.INSTANCE);

    assertEquals(List.of(1), fake.requestedPages);
    assertEquals(0, result.retrievedCount());
    assertTrue(result.items().isEmpty());
  }

  @Test
  void nonPositiveMaxResultsMakesNoCalls() {
    FakeTickets fake = new FakeTickets(10);

    BulkSearchResult result = new BulkSearch(fake).search("q", 0, NoOpProgressSink.INSTANCE);

    assertTrue(fake.requestedPages.isEmpty());
    assertEquals(0, result.retrievedCount());
  }

  @Test
  @DisplayName("An empty page ends retrieval even if more pages are announced")
  void emptyPageStopsRetrieval() {
    List<Integer> pages = new ArrayList<>();
    BulkSearch search =
        new BulkSearch(
            (query, page, perPage) -> {
              pages.add(page);
              return Map.of("pages", 5, "total", 500, "items", List.of());
            });

    BulkSearchResult result = search.search("q", 1000, NoOpProgressSink.INSTANCE);

    assertEquals(List.of(1), pages);
    assertEquals(500, result.totalAvailable());
    assertEquals(0, result.retrievedCount());
  }

  @Test
  void failingPageAbortsAndReportsStageError() {
    FakeTickets fake = new FakeTickets(300);
    RecordingSink sink = new RecordingSink();
    BulkSearch search =
        new BulkSearch(
            (query, page, perPage) -> {
              if (page == 2) {
                throw new NetworkException("Request timeout", true, null);
              }
              return fake.fetch(query, page, perPage);
            });

    NetworkException e =
        assertThrows(NetworkException.class, () -> search.search("q", 1000, sink));

    assertTrue(e.isTimeout());
    assertEquals(List.of("begin", "step", "step", "error"), sink.events);
  }

  @Test
  void reportsOneStepPerPage() {
    RecordingSink sink = new RecordingSink();

    new BulkSearch(new FakeTickets(150)).search("q", 1000, sink);

    assertEquals(List.of("begin", "step", "step", "ok"), sink.events);
  }

  private static final class RecordingSink implements ProgressSink {
    private final List<String> events = new ArrayList<>();

    @Override
    public void beginStage(String id, String label, long totalWork) {
      events.add("begin");
    }

    @Override
    public void step(String id, long completed, String message, Map<String, Object> attrs) {
      events.add("step");
    }

    @Override
    public void endStageOk(String id, Map<String, Object> attrs) {
      events.add("ok");
    }

    @Override
    public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {
      events.add("error");
    }
  }
}
