package com.gentoro.rtmcp.bulk;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate of a bulk update: {@code {total, success_count, failed_count, results: {success,
 * failed}}}. Both lists keep input order.
 */
public record BulkUpdateResult(
    @JsonProperty("total") int total,
    @JsonProperty("success_count") int successCount,
    @JsonProperty("failed_count") int failedCount,
    @JsonProperty("results") Results results) {

  public record Results(
      @JsonProperty("success") List<Long> success, @JsonProperty("failed") List<Failure> failed) {}

  public record Failure(@JsonProperty("id") long id, @JsonProperty("error") String error) {}

  public static BulkUpdateResult of(List<ItemOutcome> outcomes) {
    List<Long> success = new ArrayList<>();
    List<Failure> failed = new ArrayList<>();
    for (ItemOutcome outcome : outcomes) {
      if (outcome.success()) {
        success.add(outcome.id());
      } else {
        failed.add(new Failure(outcome.id(), outcome.error()));
      }
    }
    return new BulkUpdateResult(
        outcomes.size(), success.size(), failed.size(), new Results(success, failed));
  }
}
