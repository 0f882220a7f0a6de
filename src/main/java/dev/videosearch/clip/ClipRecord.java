package dev.videosearch.clip;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * One incoming modality embedding for a clip, as produced by ingestion before validation.
 *
 * <p>The embedding is kept as the raw JSON node from the payload so the validator can reject
 * non-array and non-numeric content rather than failing at deserialisation time.
 *
 * @param videoId parent video identifier
 * @param videoPath storage URI of the source video (e.g. {@code s3://bucket/key.mp4})
 * @param part ingestion batch that produced this record
 * @param segmentIndex position of the embedding in its source batch (diagnostics only)
 * @param timestampStart clip start in seconds
 * @param timestampEnd clip end in seconds
 * @param embeddingScope modality/granularity reported by the embedding model
 * @param embedding raw vector node, validated before admission
 * @param clipText free text used for keyword search
 * @param thumbnailUri optional preview image URI
 */
public record ClipRecord(
    String videoId,
    String videoPath,
    int part,
    int segmentIndex,
    double timestampStart,
    double timestampEnd,
    String embeddingScope,
    @Nullable JsonNode embedding,
    @Nullable String clipText,
    @Nullable String thumbnailUri) {

  /** Compact constructor validating identity fields. */
  public ClipRecord {
    if (videoId == null || videoId.isBlank()) {
      throw new IllegalArgumentException("videoId must not be blank");
    }
    if (videoPath == null) {
      throw new IllegalArgumentException("videoPath must not be null");
    }
    if (embeddingScope == null || embeddingScope.isBlank()) {
      embeddingScope = "clip";
    }
  }

  /** Deterministic clip id for this record's video and time range. */
  public String clipId() {
    return ClipIdGenerator.clipId(videoId, timestampStart, timestampEnd);
  }
}
