package dev.videosearch.api;

import dev.videosearch.search.IndexStatistics;
import dev.videosearch.search.SearchRequest;
import dev.videosearch.search.SearchResponse;
import dev.videosearch.search.SearchService;
import dev.videosearch.search.VideoListResponse;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** REST endpoints for clip search, video listing, health and index statistics. */
@RestController
public class SearchController {

  static final Map<String, String> HEALTHY = Map.of("status", "healthy", "service", "video-search");

  private final SearchService searchService;

  public SearchController(SearchService searchService) {
    this.searchService = searchService;
  }

  /**
   * Searches clips.
   *
   * @param request query text, optional video filter, result count and search type
   * @return ranked clips; 400 for an invalid request, 503 when the query cannot be embedded
   */
  @PostMapping("/search")
  public SearchResponse search(@RequestBody SearchRequest request) {
    return searchService.search(request);
  }

  /** Lists the indexed videos. */
  @GetMapping({"/list", "/videos"})
  public VideoListResponse listVideos() {
    return searchService.listVideos();
  }

  @GetMapping("/health")
  public Map<String, String> health() {
    return HEALTHY;
  }

  /** Document count and effective fusion settings per search type. */
  @GetMapping("/stats")
  public IndexStatistics stats() {
    return searchService.statistics();
  }
}
