package dev.videosearch.store;

/**
 * Optional features of the index store, resolved once at startup and handed to the query planner.
 *
 * @param nativeRankFusion the store can compute reciprocal-rank fusion server-side
 */
public record StoreCapabilities(boolean nativeRankFusion) {}
