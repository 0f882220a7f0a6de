package dev.videosearch.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of thumbnail generation for one video.
 *
 * @param videoId the video
 * @param totalClips clips of the video
 * @param processed clips that received a thumbnail
 * @param failed clips whose frame extraction, upload or update failed
 * @param skipped clips that already had a thumbnail
 * @param summarized clips whose text was replaced with a generated summary
 */
public record ThumbnailReport(
        @JsonProperty("video_id") String videoId,
        @JsonProperty("total_clips") int totalClips,
        int processed,
        int failed,
        int skipped,
        int summarized) {
}
