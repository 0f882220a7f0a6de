package dev.videosearch.clip;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A clip as stored in the index: identity, time span, keyword text and one vector per modality.
 *
 * <p>Documents returned from search queries carry no vectors; documents read for copying or
 * written by the indexer do.
 *
 * @param clipId deterministic id, see {@link ClipIdGenerator}
 * @param videoId parent video identifier
 * @param videoPath storage URI of the source video
 * @param part ingestion batch that produced the document
 * @param segmentIndex position of the first contributing embedding in its batch
 * @param timestampStart clip start in seconds (full precision)
 * @param timestampEnd clip end in seconds (full precision)
 * @param embeddingScope scope of the last contributing embedding
 * @param clipText free text used for keyword search
 * @param thumbnailUri optional preview image URI
 * @param embeddings validated vectors keyed by modality
 */
public record ClipDocument(
    String clipId,
    String videoId,
    String videoPath,
    int part,
    int segmentIndex,
    double timestampStart,
    double timestampEnd,
    @Nullable String embeddingScope,
    @Nullable String clipText,
    @Nullable String thumbnailUri,
    Map<Modality, float[]> embeddings) {

  public ClipDocument {
    embeddings =
        embeddings == null || embeddings.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(embeddings));
  }

  /**
   * Returns a copy with the given modality vector added (or replaced).
   *
   * @param modality the vector's modality
   * @param vector the validated vector
   * @param scope the scope that produced it
   * @return a new document carrying the vector
   */
  public ClipDocument withEmbedding(Modality modality, float[] vector, String scope) {
    Map<Modality, float[]> merged = new EnumMap<>(Modality.class);
    merged.putAll(embeddings);
    merged.put(modality, vector);
    return new ClipDocument(
        clipId,
        videoId,
        videoPath,
        part,
        segmentIndex,
        timestampStart,
        timestampEnd,
        scope,
        clipText,
        thumbnailUri,
        merged);
  }

  /** Returns a copy keeping only the given vectors. */
  public ClipDocument withEmbeddings(Map<Modality, float[]> vectors) {
    return new ClipDocument(
        clipId,
        videoId,
        videoPath,
        part,
        segmentIndex,
        timestampStart,
        timestampEnd,
        embeddingScope,
        clipText,
        thumbnailUri,
        vectors);
  }

  /** Returns the vector for a modality, or null when the document has none. */
  public float @Nullable [] embedding(Modality modality) {
    return embeddings.get(modality);
  }
}
