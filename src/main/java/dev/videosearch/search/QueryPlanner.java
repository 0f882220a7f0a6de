package dev.videosearch.search;

import dev.videosearch.clip.Modality;
import dev.videosearch.store.IndexSchema;
import dev.videosearch.store.SearchFilter;
import dev.videosearch.store.StoreCapabilities;
import dev.videosearch.store.VectorFieldSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the sub-queries of a search from the requested mode, the configured mode settings and
 * the store's capabilities.
 *
 * <table>
 *   <caption>Sub-queries per mode</caption>
 *   <tr><th>mode</th><th>sub-queries</th><th>fusion</th></tr>
 *   <tr><td>text</td><td>keyword match</td><td>none</td></tr>
 *   <tr><td>visual / audio</td><td>k-NN on that field, with score floor</td><td>none</td></tr>
 *   <tr><td>vector, multimodal</td><td>k-NN per weighted modality</td><td>configured</td></tr>
 *   <tr><td>hybrid</td><td>k-NN per weighted modality + keyword match</td><td>configured</td></tr>
 * </table>
 *
 * <p>k-NN sub-queries fetch {@code inner-top-k} candidates (at least {@code top_k}) so fusion has
 * enough material. RRF plans are fused in the store when it supports native rank fusion.
 */
@Component
public class QueryPlanner {

  private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

  private final SearchProperties properties;
  private final IndexSchema schema;
  private final StoreCapabilities capabilities;

  public QueryPlanner(
      SearchProperties properties, IndexSchema schema, StoreCapabilities capabilities) {
    this.properties = properties;
    this.schema = schema;
    this.capabilities = capabilities;
  }

  /**
   * Plans a search.
   *
   * @param queryText the user's query text
   * @param queryVector the embedded query; may be null only for {@link SearchMode#TEXT}
   * @param mode search mode
   * @param topK number of results requested
   * @param filter constraints applied to every sub-query
   * @return the plan
   * @throws IllegalArgumentException when the mode needs a vector and none is given
   */
  public QueryPlan plan(
      String queryText,
      float @Nullable [] queryVector,
      SearchMode mode,
      int topK,
      SearchFilter filter) {
    if (mode.requiresEmbedding() && queryVector == null) {
      throw new IllegalArgumentException("Search mode " + mode.value() + " needs a query vector");
    }
    SearchProperties.ModeSettings settings = properties.mode(mode);
    int candidates = Math.max(properties.getInnerTopK(), topK);
    List<SubQuery> subQueries = new ArrayList<>();
    FusionPolicy policy;
    switch (mode) {
      case TEXT -> {
        subQueries.add(SubQuery.match(queryText, topK, 1.0));
        policy = FusionPolicy.NONE;
      }
      case VISUAL, AUDIO -> {
        Modality modality = mode == SearchMode.VISUAL ? Modality.VISUAL : Modality.AUDIO;
        subQueries.add(
            SubQuery.knn(
                schema.field(modality), queryVector, candidates, settings.getMinScore(), 1.0));
        policy = FusionPolicy.NONE;
      }
      default -> {
        for (Map.Entry<String, Double> weight : settings.getWeights().entrySet()) {
          Optional<VectorFieldSpec> field =
              Modality.fromKey(weight.getKey()).flatMap(schema::findField);
          if (field.isEmpty()) {
            log.debug("Skipping {} sub-query: no such field", weight.getKey());
            continue;
          }
          subQueries.add(
              SubQuery.knn(
                  field.get(), queryVector, candidates, settings.getMinScore(), weight.getValue()));
        }
        if (mode == SearchMode.HYBRID && settings.getKeywordWeight() > 0.0) {
          subQueries.add(SubQuery.match(queryText, candidates, settings.getKeywordWeight()));
        }
        policy = settings.getPolicy();
      }
    }
    boolean fuseInStore =
        policy == FusionPolicy.RRF && capabilities.nativeRankFusion() && subQueries.size() > 1;
    log.debug(
        "Planned {} search: {} sub-queries, policy {}, in-store fusion {}",
        mode.value(),
        subQueries.size(),
        policy,
        fuseInStore);
    return new QueryPlan(mode, subQueries, policy, topK, filter, fuseInStore);
  }

  /**
   * The degraded plan used when the store cannot fuse: a single k-NN on the visual field, passed
   * through.
   */
  public QueryPlan fallbackPlan(QueryPlan failed, float[] queryVector) {
    SubQuery knn =
        SubQuery.knn(
            schema.field(Modality.VISUAL),
            queryVector,
            Math.max(properties.getInnerTopK(), failed.topK()),
            properties.mode(SearchMode.VISUAL).getMinScore(),
            1.0);
    return new QueryPlan(
        failed.mode(), List.of(knn), FusionPolicy.NONE, failed.topK(), failed.filter(), false);
  }

  public FusionParameters fusionParameters() {
    return properties.fusionParameters();
  }
}
