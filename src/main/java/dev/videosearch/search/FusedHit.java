package dev.videosearch.search;

import dev.videosearch.clip.ClipDocument;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A document of the fused ranking.
 *
 * @param documentId clip id
 * @param score fused score
 * @param document the stored document, when any sub-query returned it
 * @param rawScores raw score per contributing sub-query label
 */
public record FusedHit(
    String documentId, double score, @Nullable ClipDocument document, Map<String, Double> rawScores) {

  public FusedHit {
    rawScores = Map.copyOf(rawScores);
  }
}
