package dev.videosearch.store;

import dev.videosearch.clip.ClipDocument;
import org.jspecify.annotations.Nullable;

/**
 * One entry of a scored result list as returned by the store.
 *
 * @param documentId clip id
 * @param score raw score on the sub-query's own scale
 * @param document the stored document without vectors, when the store returned it
 */
public record ScoredHit(String documentId, double score, @Nullable ClipDocument document) {}
