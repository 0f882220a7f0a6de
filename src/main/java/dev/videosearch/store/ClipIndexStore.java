package dev.videosearch.store;

import dev.videosearch.clip.ClipDocument;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Port to the external vector and full-text index holding clip documents.
 *
 * <p>Every call is a blocking I/O boundary. Implementations translate throttling into {@link
 * RateLimitedException} and connectivity failures into {@link UpstreamUnavailableException}.
 * Upserts are idempotent on the clip id: writing the same id twice merges modality vectors
 * instead of creating a second document.
 */
public interface ClipIndexStore {

  /**
   * Creates the collection with its vector and keyword fields if it does not exist yet. Existing
   * fields are checked against the declared dimension.
   *
   * @throws IllegalStateException when an existing field has a different dimension
   */
  void ensureSchema(IndexSchema schema);

  boolean exists(String collection);

  /** Inserts the document or merges it into the stored document with the same clip id. */
  void upsert(String collection, ClipDocument document);

  /**
   * Writes a batch of documents, reporting an outcome per document. A failure of one document
   * does not prevent the others from being written.
   *
   * @throws RateLimitedException when the store throttles the batch; no outcome is reported
   */
  List<BulkItemOutcome> bulkUpsert(String collection, List<ClipDocument> documents);

  /** Deletes all clips of a video and returns how many were removed. */
  int deleteByVideoId(String collection, String videoId);

  /** Sets the thumbnail URI of a clip. Returns false when the clip does not exist. */
  boolean updateThumbnail(String collection, String clipId, String thumbnailUri);

  /** Replaces the keyword text of a clip. Returns false when the clip does not exist. */
  boolean updateClipText(String collection, String clipId, String clipText);

  /** Nearest neighbours of the query vector, best first, with the store's similarity scores. */
  List<ScoredHit> knnQuery(String collection, KnnQuery query, SearchFilter filter);

  /** Keyword matches on the keyword field, most relevant first. */
  List<ScoredHit> matchQuery(String collection, MatchQuery query, SearchFilter filter);

  /**
   * Runs the given sub-queries and combines them server-side with reciprocal-rank fusion. The
   * returned scores are raw RRF sums.
   *
   * @throws FusionUnavailableException when the store cannot fuse for this collection
   */
  List<ScoredHit> rankFusionQuery(
      String collection,
      List<KnnQuery> knnQueries,
      @Nullable MatchQuery matchQuery,
      int rankConstant,
      int size,
      SearchFilter filter);

  /**
   * Reads documents with their vectors in clip id order, starting after {@code afterClipId}.
   *
   * @param afterClipId last clip id of the previous page, or null for the first page
   */
  List<ClipDocument> page(String collection, @Nullable String afterClipId, int limit);

  long count(String collection);

  Optional<ClipDocument> findById(String collection, String clipId);

  /** Clips of one video ordered by start time, without vectors. */
  List<ClipDocument> findByVideoId(String collection, String videoId);

  /** Distinct videos of a collection ordered by video path. */
  List<VideoSummary> listVideos(String collection);
}
