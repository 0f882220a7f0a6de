package dev.videosearch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** New keyword text for a clip. */
public record ClipTextRequest(@JsonProperty("clip_text") String clipText) {}
