package dev.videosearch.search;

import java.util.List;

/** All indexed videos. */
public record VideoListResponse(List<VideoResult> videos, int total) {}
