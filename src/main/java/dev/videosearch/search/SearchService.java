package dev.videosearch.search;

import dev.videosearch.embedding.EmbeddingGateway;
import dev.videosearch.store.ClipIndexStore;
import dev.videosearch.store.FusionUnavailableException;
import dev.videosearch.store.IndexSchemaManager;
import dev.videosearch.store.KnnQuery;
import dev.videosearch.store.MatchQuery;
import dev.videosearch.store.ScoredHit;
import dev.videosearch.store.SearchFilter;
import dev.videosearch.store.StoreCapabilities;
import dev.videosearch.store.UpstreamUnavailableException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Orchestrates a search: query embedding, planning, sub-query execution, fusion and presentation.
 *
 * <p>Pipeline: embed the query text (skipped for {@code text} mode), plan the sub-queries, run them
 * against the store (or let the store fuse them with RRF), fuse with {@link FusionEngine}, and map
 * the ranking with {@link ResultPresenter}. When the store's rank fusion is unavailable the search
 * degrades to a single visual k-NN query instead of failing.
 */
@Service
public class SearchService {

  private static final Logger log = LoggerFactory.getLogger(SearchService.class);

  private final EmbeddingGateway embeddingGateway;
  private final QueryPlanner queryPlanner;
  private final ClipIndexStore store;
  private final IndexSchemaManager schemaManager;
  private final ResultPresenter presenter;
  private final SearchProperties properties;
  private final StoreCapabilities capabilities;

  public SearchService(
      EmbeddingGateway embeddingGateway,
      QueryPlanner queryPlanner,
      ClipIndexStore store,
      IndexSchemaManager schemaManager,
      ResultPresenter presenter,
      SearchProperties properties,
      StoreCapabilities capabilities) {
    this.embeddingGateway = embeddingGateway;
    this.queryPlanner = queryPlanner;
    this.store = store;
    this.schemaManager = schemaManager;
    this.presenter = presenter;
    this.properties = properties;
    this.capabilities = capabilities;
  }

  /**
   * Runs a search.
   *
   * @param request the search request
   * @return the ranked clips
   * @throws IllegalArgumentException for an unknown search type
   * @throws UpstreamUnavailableException when the query cannot be embedded or the store is
   *     unreachable
   */
  public SearchResponse search(SearchRequest request) {
    SearchMode mode = SearchMode.fromValue(request.searchType());
    int topK = resolveTopK(request.topK());
    log.info(
        "Searching for '{}' (type: {}, top_k: {}, video: {})",
        request.queryText(),
        mode.value(),
        topK,
        request.videoId());
    List<FusedHit> hits =
        searchHits(request.queryText(), mode, topK, SearchFilter.forVideo(request.videoId()));
    log.info("Found {} results", hits.size());
    return presenter.present(request.queryText(), mode, hits, request.includeScores());
  }

  /**
   * Runs a search and returns the fused ranking before presentation.
   *
   * @param queryText the query text
   * @param mode search mode
   * @param topK number of hits
   * @param filter constraints applied to every sub-query
   * @return fused hits, best first
   */
  public List<FusedHit> searchHits(
      String queryText, SearchMode mode, int topK, SearchFilter filter) {
    schemaManager.ensureSchema();
    float[] queryVector = null;
    if (mode.requiresEmbedding()) {
      queryVector =
          embeddingGateway
              .embedText(queryText)
              .orElseThrow(
                  () -> new UpstreamUnavailableException("Failed to generate query embedding"));
    }
    QueryPlan plan = queryPlanner.plan(queryText, queryVector, mode, topK, filter);
    if (plan.fuseInStore()) {
      try {
        return fuseInStore(plan);
      } catch (FusionUnavailableException e) {
        log.warn(
            "Rank fusion unavailable, falling back to visual k-NN search: {}", e.getMessage());
        plan = queryPlanner.fallbackPlan(plan, queryVector);
      }
    }
    return execute(plan);
  }

  private List<FusedHit> fuseInStore(QueryPlan plan) {
    List<KnnQuery> knn = new ArrayList<>();
    MatchQuery match = null;
    for (SubQuery subQuery : plan.subQueries()) {
      if (subQuery.kind() == SubQuery.Kind.KNN) {
        knn.add(subQuery.toKnnQuery());
      } else {
        match = subQuery.toMatchQuery();
      }
    }
    FusionParameters parameters = queryPlanner.fusionParameters();
    List<ScoredHit> hits =
        store.rankFusionQuery(
            collection(),
            knn,
            match,
            parameters.rankConstant(),
            plan.topK(),
            plan.filter());
    return FusionEngine.normalizeRankFusion(hits, parameters, plan.topK());
  }

  private List<FusedHit> execute(QueryPlan plan) {
    List<RankedList> lists = new ArrayList<>(plan.subQueries().size());
    for (SubQuery subQuery : plan.subQueries()) {
      List<ScoredHit> hits =
          subQuery.kind() == SubQuery.Kind.KNN
              ? store.knnQuery(collection(), subQuery.toKnnQuery(), plan.filter())
              : store.matchQuery(collection(), subQuery.toMatchQuery(), plan.filter());
      log.debug("Sub-query {} returned {} hits", subQuery.label(), hits.size());
      lists.add(new RankedList(subQuery.label(), subQuery.weight(), hits));
    }
    return FusionEngine.fuse(lists, plan.policy(), queryPlanner.fusionParameters(), plan.topK());
  }

  /** Lists the distinct indexed videos. */
  public VideoListResponse listVideos() {
    schemaManager.ensureSchema();
    return presenter.presentVideos(store.listVideos(collection()));
  }

  /** Reports the document count and the effective fusion configuration. */
  public IndexStatistics statistics() {
    Map<String, IndexStatistics.ModeSummary> modes = new LinkedHashMap<>();
    for (SearchMode mode : SearchMode.values()) {
      SearchProperties.ModeSettings settings = properties.mode(mode);
      modes.put(
          mode.value(),
          new IndexStatistics.ModeSummary(
              settings.getPolicy(),
              new LinkedHashMap<>(settings.getWeights()),
              settings.getKeywordWeight(),
              settings.getMinScore()));
    }
    return new IndexStatistics(
        collection(), store.count(collection()), capabilities.nativeRankFusion(), modes);
  }

  private int resolveTopK(@Nullable Integer requested) {
    if (requested == null) {
      return properties.getDefaultTopK();
    }
    return Math.min(requested, properties.getMaxTopK());
  }

  private String collection() {
    return schemaManager.defaultSchema().collection();
  }
}
