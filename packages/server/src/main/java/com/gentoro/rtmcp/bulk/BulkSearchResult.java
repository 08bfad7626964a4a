package com.gentoro.rtmcp.bulk;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record BulkSearchResult(
    @JsonProperty("query") String query,
    @JsonProperty("total_available") int totalAvailable,
    @JsonProperty("retrieved_count") int retrievedCount,
    @JsonProperty("max_results") int maxResults,
    @JsonProperty("items") List<Map<String, Object>> items) {}
