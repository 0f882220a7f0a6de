package dev.videosearch.search;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Search response.
 *
 * @param query the query text
 * @param searchType the mode that served the search
 * @param total number of clips returned
 * @param clips clips, best first
 */
public record SearchResponse(
    String query, @JsonProperty("search_type") String searchType, int total, List<ClipResult> clips) {

  public SearchResponse {
    clips = List.copyOf(clips);
  }
}
