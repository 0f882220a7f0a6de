package dev.videosearch.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of ingesting one part of a video.
 *
 * @param videoId the video id the clips were indexed under
 * @param part ingestion batch number
 * @param summary per-record counts
 */
public record IngestionResult(@JsonProperty("video_id") String videoId, int part, IngestionSummary summary) {
}
