package dev.videosearch.ingestion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * One segment of an embedding model output: a time range, the embedding option that produced it
 * and the raw vector.
 *
 * @param startSec segment start in seconds
 * @param endSec segment end in seconds
 * @param embeddingOption embedding scope, e.g. {@code visual-text} or {@code audio}
 * @param embedding raw vector node, validated by the indexer
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingSegment(
        double startSec,
        double endSec,
        @Nullable String embeddingOption,
        @Nullable JsonNode embedding) {
}
