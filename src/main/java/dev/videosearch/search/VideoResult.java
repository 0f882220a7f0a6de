package dev.videosearch.search;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A video of the catalogue listing.
 *
 * @param videoId video id
 * @param videoPath time-limited URL of the video, or its stored reference
 * @param title clip text of the first clip, or a placeholder derived from the id
 * @param clipsCount number of indexed clips
 */
public record VideoResult(
    @JsonProperty("video_id") String videoId,
    @JsonProperty("video_path") String videoPath,
    String title,
    @JsonProperty("clips_count") long clipsCount) {}
