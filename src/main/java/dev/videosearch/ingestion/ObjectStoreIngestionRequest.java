package dev.videosearch.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * Ingestion of an embedding model output stored in the object store.
 *
 * @param outputUri {@code s3://} prefix holding {@code output.json}
 * @param videoPath storage URI of the source video
 * @param part ingestion batch number
 * @param videoId parent video id; a random UUID is assigned when absent
 */
public record ObjectStoreIngestionRequest(
        @NotBlank @JsonProperty("output_uri") String outputUri,
        @NotBlank @JsonProperty("video_path") String videoPath,
        @Min(0) int part,
        @JsonProperty("video_id") @Nullable String videoId) {
}
