package dev.videosearch.search;

import dev.videosearch.store.ScoredHit;
import java.util.List;

/**
 * The scored hits of one sub-query, in the order the store returned them.
 *
 * @param label sub-query label, e.g. {@code knn:visual} or {@code match}
 * @param weight the sub-query's weight under weighted policies
 * @param hits hits, best first
 */
public record RankedList(String label, double weight, List<ScoredHit> hits) {

  public RankedList {
    hits = List.copyOf(hits);
  }
}
