package com.gentoro.rtmcp.bulk;

import com.gentoro.rtmcp.client.PaginatedResult;
import com.gentoro.rtmcp.client.RtClient;
import com.gentoro.rtmcp.exception.ExceptionUtil;
import com.gentoro.rtmcp.progress.ProgressSink;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Paginated retrieval that accumulates up to {@code maxResults} items.
 *
 * <p>Pages of {@value #PAGE_SIZE} are fetched sequentially starting at page 1. Retrieval stops
 * once enough items were accumulated, when the last reported page was reached, or when a page
 * comes back empty; the accumulated list is then truncated to {@code maxResults}. The first failing
 * page aborts the whole search and its exception propagates unchanged, no partial result is
 * returned.
 */
public class BulkSearch {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(BulkSearch.class);

  public static final int PAGE_SIZE = 100;
  public static final int DEFAULT_MAX_RESULTS = 1000;
  static final String STAGE = "search";

  /** Source of one page of results. */
  @FunctionalInterface
  public interface PageFetcher {
    Map<String, Object> fetch(String query, int page, int perPage);
  }

  private final PageFetcher fetcher;

  public BulkSearch(PageFetcher fetcher) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
  }

  /** Bulk search over {@code GET /tickets}. */
  public static BulkSearch tickets(RtClient client) {
    return new BulkSearch(client::searchTickets);
  }

  public BulkSearchResult search(String query, int maxResults, ProgressSink progress) {
    if (maxResults <= 0) {
      log.debug("max_results {} requested, nothing to retrieve", maxResults);
      return new BulkSearchResult(query, 0, 0, maxResults, List.of());
    }

    progress.beginStage(STAGE, "Searching: " + query, maxResults);
    List<Map<String, Object>> accumulated = new ArrayList<>();
    int totalAvailable = 0;
    int page = 1;
    try {
      while (accumulated.size() < maxResults) {
        progress.step(STAGE, accumulated.size(), "Page " + page, Map.of("page", page));

        PaginatedResult result = PaginatedResult.from(fetcher.fetch(query, page, PAGE_SIZE));
        accumulated.addAll(result.items());
        totalAvailable = result.total();
        log.debug(
            "Retrieved page {}/{} ({} items)", page, result.pages(), result.items().size());

        if (page >= result.pages() || result.items().isEmpty()) {
          break;
        }
        page++;
      }
    } catch (RuntimeException e) {
      progress.endStageError(STAGE, ExceptionUtil.describe(e), Map.of("page", page));
      throw e;
    }

    List<Map<String, Object>> items =
        accumulated.size() > maxResults
            ? new ArrayList<>(accumulated.subList(0, maxResults))
            : accumulated;
    progress.endStageOk(STAGE, Map.of("retrieved", items.size()));
    log.info("Retrieved {} items (total available: {})", items.size(), totalAvailable);
    return new BulkSearchResult(query, totalAvailable, items.size(), maxResults, items);
  }
}
