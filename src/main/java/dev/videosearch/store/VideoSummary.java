package dev.videosearch.store;

import org.jspecify.annotations.Nullable;

/**
 * A distinct video present in a collection.
 *
 * @param videoId video identifier
 * @param videoPath storage URI of the source video
 * @param title clip text of the video's earliest clip
 * @param clipCount number of clips indexed for the video
 */
public record VideoSummary(String videoId, String videoPath, @Nullable String title, long clipCount) {}
