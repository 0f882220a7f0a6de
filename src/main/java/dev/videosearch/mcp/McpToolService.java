package dev.videosearch.mcp;

import dev.videosearch.search.IndexStatistics;
import dev.videosearch.search.SearchRequest;
import dev.videosearch.search.SearchResponse;
import dev.videosearch.search.SearchService;
import dev.videosearch.search.VideoListResponse;
import dev.videosearch.search.VideoResult;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing clip search as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Tools: {@code search_videos}, {@code list_videos}, {@code index_statistics}.
 *
 * @see ClipResultFormatter
 */
@Service
public class McpToolService {

  static final int DEFAULT_MAX_RESULTS = 10;
  static final int MAX_RESULTS_LIMIT = 50;

  private final SearchService searchService;
  private final ClipResultFormatter formatter;

  public McpToolService(SearchService searchService, ClipResultFormatter formatter) {
    this.searchService = searchService;
    this.formatter = formatter;
  }

  /** Searches indexed video clips and formats the ranking within the token budget. */
  @Tool(
      name = "search_videos",
      description =
          "Search indexed video clips by natural language. "
              + "Returns matching clips with video id, time range, score and links to the video and thumbnail. "
              + "The search type selects which embeddings are queried and how their scores are fused.")
  public String searchVideos(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Maximum number of clips (1-50, default 10)", required = false)
          @Nullable Integer maxResults,
      @ToolParam(
              description =
                  "Search type: hybrid (default), vector, text, visual, audio or multimodal",
              required = false)
          @Nullable String searchType,
      @ToolParam(description = "Restrict the search to one video id", required = false)
          @Nullable String videoId) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      SearchResponse response =
          searchService.search(
              new SearchRequest(query, videoId, clampMaxResults(maxResults), searchType, false));
      if (response.clips().isEmpty()) {
        return videoId == null
            ? "No clips found for query: " + query
            : "No clips found for query '%s' in video %s.".formatted(query, videoId);
      }
      return formatter.format(response.clips());
    } catch (Exception e) {
      return "Error searching videos: " + e.getMessage();
    }
  }

  /** Lists the indexed videos with their clip counts. */
  @Tool(
      name = "list_videos",
      description = "List all indexed videos with title, clip count and a link to the video.")
  public String listVideos() {
    try {
      VideoListResponse response = searchService.listVideos();
      if (response.videos().isEmpty()) {
        return "No videos indexed yet.";
      }
      StringBuilder sb = new StringBuilder();
      for (VideoResult video : response.videos()) {
        sb.append(
            String.format(
                "- %s (%s): %d clips | %s%n",
                video.title(), video.videoId(), video.clipsCount(), video.videoPath()));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error listing videos: " + e.getMessage();
    }
  }

  /** Reports the document count and the fusion settings of every search type. */
  @Tool(
      name = "index_statistics",
      description =
          "View index statistics: clip document count, whether rank fusion runs in the store, "
              + "and the fusion policy and weights of every search type.")
  public String indexStatistics() {
    try {
      IndexStatistics stats = searchService.statistics();
      StringBuilder sb = new StringBuilder();
      sb.append(String.format("Index Statistics (%s):%n", stats.collection()));
      sb.append(String.format("- Clip documents: %,d%n", stats.documentCount()));
      sb.append(
          String.format(
              "- Rank fusion: %s%n", stats.nativeRankFusion() ? "in store" : "in application"));
      sb.append(String.format("Search types:%n"));
      for (Map.Entry<String, IndexStatistics.ModeSummary> entry : stats.modes().entrySet()) {
        IndexStatistics.ModeSummary mode = entry.getValue();
        sb.append(
            String.format(
                "- %s: %s, weights %s, keyword %.2f%s%n",
                entry.getKey(),
                mode.policy(),
                mode.weights(),
                mode.keywordWeight(),
                mode.minScore() != null ? ", min score " + mode.minScore() : ""));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error retrieving index statistics: " + e.getMessage();
    }
  }

  private int clampMaxResults(@Nullable Integer maxResults) {
    if (maxResults == null || maxResults < 1) {
      return DEFAULT_MAX_RESULTS;
    }
    return Math.min(maxResults, MAX_RESULTS_LIMIT);
  }
}
