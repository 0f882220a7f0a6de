package dev.videosearch.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Document count and the effective search configuration.
 *
 * @param collection collection name
 * @param documentCount number of clip documents
 * @param nativeRankFusion whether RRF is computed by the store
 * @param modes fusion settings per search mode
 */
public record IndexStatistics(
    String collection,
    @JsonProperty("document_count") long documentCount,
    @JsonProperty("native_rank_fusion") boolean nativeRankFusion,
    Map<String, ModeSummary> modes) {

  /** Fusion settings of one mode. */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ModeSummary(
      FusionPolicy policy,
      Map<String, Double> weights,
      @JsonProperty("keyword_weight") double keywordWeight,
      @JsonProperty("min_score") @Nullable Double minScore) {}
}
