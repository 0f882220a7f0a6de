package dev.videosearch.api;

import dev.videosearch.ingestion.ClipIndexer;
import dev.videosearch.ingestion.ClipIngestionRequest;
import dev.videosearch.ingestion.CollectionCopyService;
import dev.videosearch.ingestion.CopyReport;
import dev.videosearch.ingestion.IngestionResult;
import dev.videosearch.ingestion.IngestionService;
import dev.videosearch.ingestion.ObjectStoreIngestionRequest;
import dev.videosearch.ingestion.ThumbnailReport;
import dev.videosearch.ingestion.ThumbnailService;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST endpoints that write to the clip index: payload ingestion, video deletion, thumbnail
 * generation, clip text replacement and collection copy.
 */
@RestController
public class IngestionController {

  private final IngestionService ingestionService;
  private final ClipIndexer clipIndexer;
  private final ThumbnailService thumbnailService;
  private final CollectionCopyService copyService;

  public IngestionController(
      IngestionService ingestionService,
      ClipIndexer clipIndexer,
      ThumbnailService thumbnailService,
      CollectionCopyService copyService) {
    this.ingestionService = ingestionService;
    this.clipIndexer = clipIndexer;
    this.thumbnailService = thumbnailService;
    this.copyService = copyService;
  }

  /** Indexes segments posted in the request body. */
  @PostMapping("/ingest")
  public IngestionResult ingest(@RequestBody ClipIngestionRequest request) {
    return ingestionService.ingest(request);
  }

  /** Indexes the {@code output.json} of an embedding job stored in the object store. */
  @PostMapping("/ingest/object-store")
  public IngestionResult ingestFromObjectStore(@RequestBody ObjectStoreIngestionRequest request) {
    return ingestionService.ingestFromObjectStore(request);
  }

  @DeleteMapping("/videos/{videoId}")
  public Map<String, Object> deleteVideo(@PathVariable String videoId) {
    return Map.of("video_id", videoId, "deleted", clipIndexer.deleteVideo(videoId));
  }

  @PostMapping("/videos/{videoId}/thumbnails")
  public ThumbnailReport generateThumbnails(@PathVariable String videoId) {
    return thumbnailService.generateThumbnails(videoId);
  }

  /**
   * Replaces the keyword text of a clip.
   *
   * @return 404 when the clip does not exist
   */
  @PutMapping("/clips/{clipId}/text")
  public Map<String, String> replaceClipText(
      @PathVariable String clipId, @RequestBody ClipTextRequest request) {
    if (!clipIndexer.replaceClipText(clipId, request.clipText())) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Clip not found: " + clipId);
    }
    return Map.of("clip_id", clipId, "clip_text", request.clipText());
  }

  @PostMapping("/collections/copy")
  public CopyReport copyCollection(@RequestBody CopyCollectionRequest request) {
    return copyService.copy(request.source(), request.target());
  }
}
