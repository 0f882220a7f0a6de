package dev.videosearch.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Direct ingestion of embedding segments for one part of a video.
 *
 * <p>Segments are not validated here: invalid embeddings are skipped and counted by the indexer.
 *
 * @param videoPath storage URI of the source video
 * @param videoId parent video id; a random UUID is assigned when absent
 * @param part ingestion batch number
 * @param clipText keyword text of the clips; the video file name when absent
 * @param segments embedding segments
 */
public record ClipIngestionRequest(
        @NotBlank @JsonProperty("video_path") String videoPath,
        @JsonProperty("video_id") @Nullable String videoId,
        @Min(0) int part,
        @JsonProperty("clip_text") @Nullable String clipText,
        @NotNull List<EmbeddingSegment> segments) {
    public ClipIngestionRequest {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }
}
