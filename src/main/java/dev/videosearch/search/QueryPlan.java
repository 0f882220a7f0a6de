package dev.videosearch.search;

import dev.videosearch.store.SearchFilter;
import java.util.List;

/**
 * The sub-queries of a search and how to combine them.
 *
 * @param mode requested search mode
 * @param subQueries sub-queries in fusion order
 * @param policy fusion policy
 * @param topK number of results to return
 * @param filter constraints applied to every sub-query
 * @param fuseInStore whether the store computes the fusion itself (RRF with native support)
 */
public record QueryPlan(
    SearchMode mode,
    List<SubQuery> subQueries,
    FusionPolicy policy,
    int topK,
    SearchFilter filter,
    boolean fuseInStore) {

  public QueryPlan {
    subQueries = List.copyOf(subQueries);
  }
}
