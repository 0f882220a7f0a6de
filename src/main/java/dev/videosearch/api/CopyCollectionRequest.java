package dev.videosearch.api;

/**
 * Body of a collection copy.
 *
 * @param source collection to read
 * @param target collection to write, created when missing
 */
public record CopyCollectionRequest(String source, String target) {}
