package dev.videosearch.search;

import dev.videosearch.clip.ClipDocument;
import dev.videosearch.media.ObjectStore;
import dev.videosearch.media.ObjectStoreException;
import dev.videosearch.media.S3Uri;
import dev.videosearch.store.VideoSummary;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps fused hits and video summaries to response records.
 *
 * <p>Object store references ({@code s3://...}) are replaced by presigned URLs; a reference that
 * cannot be signed is returned unchanged. Raw sub-query scores are only kept when requested.
 */
@Component
public class ResultPresenter {

  private static final Logger log = LoggerFactory.getLogger(ResultPresenter.class);

  private final ObjectStore objectStore;
  private final Duration presignTtl;

  public ResultPresenter(ObjectStore objectStore, SearchProperties properties) {
    this.objectStore = objectStore;
    this.presignTtl = Duration.ofSeconds(properties.getPresignTtlSeconds());
  }

  /**
   * Builds the search response.
   *
   * @param query the query text
   * @param mode the mode that served the search
   * @param hits fused hits, best first
   * @param includeScores whether to keep raw sub-query scores
   * @return the response, in hit order
   */
  public SearchResponse present(
      String query, SearchMode mode, List<FusedHit> hits, boolean includeScores) {
    List<ClipResult> clips = new ArrayList<>(hits.size());
    for (FusedHit hit : hits) {
      ClipDocument document = hit.document();
      if (document == null) {
        log.debug("Dropping hit {} without stored document", hit.documentId());
        continue;
      }
      clips.add(
          new ClipResult(
              document.clipId(),
              document.videoId(),
              accessUrl(document.videoPath()),
              document.timestampStart(),
              document.timestampEnd(),
              document.clipText(),
              hit.score(),
              accessUrlOrNull(document.thumbnailUri()),
              includeScores ? hit.rawScores() : null));
    }
    return new SearchResponse(query, mode.value(), clips.size(), clips);
  }

  /** Builds the catalogue listing. */
  public VideoListResponse presentVideos(List<VideoSummary> videos) {
    List<VideoResult> results =
        videos.stream()
            .map(
                v ->
                    new VideoResult(
                        v.videoId(),
                        accessUrl(v.videoPath()),
                        title(v),
                        v.clipCount()))
            .toList();
    return new VideoListResponse(results, results.size());
  }

  private static String title(VideoSummary video) {
    if (video.title() != null && !video.title().isBlank()) {
      return video.title();
    }
    String id = video.videoId();
    return "Video " + id.substring(0, Math.min(8, id.length()));
  }

  /** Presigns object store references; anything else passes through. */
  String accessUrl(String reference) {
    Optional<S3Uri> uri = S3Uri.tryParse(reference);
    if (uri.isEmpty()) {
      return reference;
    }
    try {
      return objectStore.presign(uri.get(), presignTtl);
    } catch (ObjectStoreException e) {
      log.warn("Could not presign {}: {}", reference, e.getMessage());
      return reference;
    }
  }

  private @Nullable String accessUrlOrNull(@Nullable String reference) {
    return reference == null ? null : accessUrl(reference);
  }
}
