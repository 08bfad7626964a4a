package com.gentoro.rtmcp.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.rtmcp.utility.JacksonUtility;
import java.util.List;
import java.util.Map;

/**
 * One page of an RT collection response: {@code {count, page, pages, per_page, total, items}}.
 *
 * <p>Missing counters read as zero, except {@code pages} which reads as 1 and {@code page} which
 * reads as 1.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PaginatedResult(
    @JsonProperty("count") Integer count,
    @JsonProperty("page") Integer page,
    @JsonProperty("pages") Integer pages,
    @JsonProperty("per_page") Integer perPage,
    @JsonProperty("total") Integer total,
    @JsonProperty("items") List<Map<String, Object>> items) {

  public PaginatedResult {
    count = count == null ? 0 : count;
    page = page == null ? 1 : page;
    pages = pages == null ? 1 : pages;
    perPage = perPage == null ? 0 : perPage;
    total = total == null ? 0 : total;
    items = items == null ? List.of() : items;
  }

  public static PaginatedResult from(Map<String, Object> response) {
    return JacksonUtility.convert(response, PaginatedResult.class);
  }
}
