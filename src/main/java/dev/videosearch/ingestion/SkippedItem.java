package dev.videosearch.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A document left out of a collection copy.
 *
 * @param clipId clip id
 * @param videoId parent video
 * @param reason why it was left out
 */
public record SkippedItem(
        @JsonProperty("clip_id") String clipId,
        @JsonProperty("video_id") String videoId,
        String reason) {
}
