package dev.videosearch.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * One clip of a search response.
 *
 * @param clipId clip id
 * @param videoId parent video
 * @param videoPath time-limited URL of the source video, or its stored reference when it cannot
 *     be signed
 * @param timestampStart clip start in seconds
 * @param timestampEnd clip end in seconds
 * @param clipText clip text
 * @param score fused score
 * @param thumbnailUrl time-limited thumbnail URL, when the clip has a thumbnail
 * @param rawScores raw score per sub-query; only when requested
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClipResult(
    @JsonProperty("clip_id") String clipId,
    @JsonProperty("video_id") String videoId,
    @JsonProperty("video_path") String videoPath,
    @JsonProperty("timestamp_start") double timestampStart,
    @JsonProperty("timestamp_end") double timestampEnd,
    @JsonProperty("clip_text") @Nullable String clipText,
    double score,
    @JsonProperty("thumbnail_url") @Nullable String thumbnailUrl,
    @JsonProperty("raw_scores") @Nullable Map<String, Double> rawScores) {}
