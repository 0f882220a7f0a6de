package dev.videosearch.search;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Search request as accepted by the REST endpoint and the MCP tool.
 *
 * @param queryText the query text (must not be null or blank)
 * @param videoId optional video to search within
 * @param topK number of clips to return; the configured default when null
 * @param searchType one of {@code hybrid}, {@code vector}, {@code text}, {@code visual}, {@code
 *     audio}, {@code multimodal}; {@code hybrid} when null
 * @param includeScores whether to keep the raw per-sub-query scores in the results
 */
public record SearchRequest(
    @JsonProperty("query_text") String queryText,
    @JsonProperty("video_id") @Nullable String videoId,
    @JsonProperty("top_k") @Nullable Integer topK,
    @JsonProperty("search_type") @Nullable String searchType,
    @JsonProperty("include_scores") boolean includeScores) {

  /** Compact constructor validating input. */
  public SearchRequest {
    if (queryText == null || queryText.isBlank()) {
      throw new IllegalArgumentException("query_text is required");
    }
    if (topK != null && topK < 1) {
      throw new IllegalArgumentException("top_k must be at least 1");
    }
  }

  /** Convenience constructor for a search over all videos without raw scores. */
  public SearchRequest(String queryText, @Nullable Integer topK, @Nullable String searchType) {
    this(queryText, null, topK, searchType, false);
  }
}
