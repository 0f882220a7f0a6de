package dev.videosearch.store;

/**
 * Keyword relevance query on the collection's keyword field.
 *
 * @param text query text
 * @param size maximum number of hits
 */
public record MatchQuery(String text, int size) {}
