package dev.videosearch.fixture;

import dev.videosearch.clip.ClipDocument;
import dev.videosearch.clip.Modality;
import dev.videosearch.store.BulkItemOutcome;
import dev.videosearch.store.ClipIndexStore;
import dev.videosearch.store.FusionUnavailableException;
import dev.videosearch.store.IndexSchema;
import dev.videosearch.store.KnnQuery;
import dev.videosearch.store.MatchQuery;
import dev.videosearch.store.RateLimitedException;
import dev.videosearch.store.ScoredHit;
import dev.videosearch.store.SearchFilter;
import dev.videosearch.store.UpstreamUnavailableException;
import dev.videosearch.store.VideoSummary;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * {@link ClipIndexStore} over in-memory maps, following the merge rules of the PostgreSQL adapter:
 * modality vectors and the thumbnail are overwritten only by non-null values and an existing clip
 * text is kept.
 *
 * <p>k-NN scores are cosine similarities mapped to [0, 1]; keyword scores count the query terms
 * found in the clip text. Failures can be injected per clip id and for bulk writes.
 */
public class InMemoryClipIndexStore implements ClipIndexStore {

  private final Map<String, IndexSchema> schemas = new HashMap<>();
  private final Map<String, TreeMap<String, ClipDocument>> collections = new HashMap<>();
  private final Set<String> failingClipIds = new HashSet<>();
  private int rateLimitedBulkWrites;
  private int bulkWriteCalls;
  private boolean fusionUnavailable;
  private int rateLimitedPageReads;
  private int pageReadCalls;
  private final Set<String> failingThumbnailUpdates = new HashSet<>();

  /** Makes every write of the given clip fail. */
  public InMemoryClipIndexStore failWritesFor(String clipId) {
    failingClipIds.add(clipId);
    return this;
  }

  /** Makes the next {@code count} bulk writes fail with {@link RateLimitedException}. */
  public InMemoryClipIndexStore rateLimitNextBulkWrites(int count) {
    this.rateLimitedBulkWrites = count;
    return this;
  }

  /** Makes the next {@code count} page reads fail with {@link RateLimitedException}. */
  public InMemoryClipIndexStore rateLimitNextPageReads(int count) {
    this.rateLimitedPageReads = count;
    return this;
  }

  /** Makes thumbnail updates of the given clip fail as if the store were unreachable. */
  public InMemoryClipIndexStore failThumbnailUpdatesFor(String clipId) {
    failingThumbnailUpdates.add(clipId);
    return this;
  }

  public InMemoryClipIndexStore withoutRankFusion() {
    this.fusionUnavailable = true;
    return this;
  }

  public int bulkWriteCalls() {
    return bulkWriteCalls;
  }

  public int pageReadCalls() {
    return pageReadCalls;
  }

  public List<ClipDocument> documents(String collection) {
    return new ArrayList<>(collection(collection).values());
  }

  @Override
  public void ensureSchema(IndexSchema schema) {
    schemas.putIfAbsent(schema.collection(), schema);
    collections.computeIfAbsent(schema.collection(), c -> new TreeMap<>());
  }

  @Override
  public boolean exists(String collection) {
    return collections.containsKey(collection);
  }

  @Override
  public void upsert(String collection, ClipDocument document) {
    if (failingClipIds.contains(document.clipId())) {
      throw new IllegalStateException("Injected write failure for " + document.clipId());
    }
    collection(collection).merge(document.clipId(), document, InMemoryClipIndexStore::merge);
  }

  @Override
  public List<BulkItemOutcome> bulkUpsert(String collection, List<ClipDocument> documents) {
    bulkWriteCalls++;
    if (rateLimitedBulkWrites > 0) {
      rateLimitedBulkWrites--;
      throw new RateLimitedException("Too many requests", new IllegalStateException("429"));
    }
    List<BulkItemOutcome> outcomes = new ArrayList<>(documents.size());
    for (ClipDocument document : documents) {
      try {
        upsert(collection, document);
        outcomes.add(BulkItemOutcome.created(document.clipId()));
      } catch (IllegalStateException e) {
        outcomes.add(BulkItemOutcome.failed(document.clipId(), e.getMessage()));
      }
    }
    return outcomes;
  }

  @Override
  public int deleteByVideoId(String collection, String videoId) {
    TreeMap<String, ClipDocument> documents = collection(collection);
    int before = documents.size();
    documents.values().removeIf(d -> d.videoId().equals(videoId));
    return before - documents.size();
  }

  @Override
  public boolean updateThumbnail(String collection, String clipId, String thumbnailUri) {
    if (failingThumbnailUpdates.contains(clipId)) {
      throw new UpstreamUnavailableException("Store unreachable", new IllegalStateException(clipId));
    }
    ClipDocument d = collection(collection).get(clipId);
    if (d == null) {
      return false;
    }
    collection(collection).put(clipId, copy(d, d.clipText(), thumbnailUri, d.embeddings()));
    return true;
  }

  @Override
  public boolean updateClipText(String collection, String clipId, String clipText) {
    ClipDocument d = collection(collection).get(clipId);
    if (d == null) {
      return false;
    }
    collection(collection).put(clipId, copy(d, clipText, d.thumbnailUri(), d.embeddings()));
    return true;
  }

  @Override
  public List<ScoredHit> knnQuery(String collection, KnnQuery query, SearchFilter filter) {
    List<ScoredHit> hits = new ArrayList<>();
    for (ClipDocument document : filtered(collection, filter)) {
      float[] vector = document.embedding(query.field().modality());
      if (vector == null) {
        continue;
      }
      double score = (1.0 + cosine(vector, query.vector())) / 2.0;
      if (query.minScore() == null || score >= query.minScore()) {
        hits.add(new ScoredHit(document.clipId(), score, document));
      }
    }
    return top(hits, query.k());
  }

  @Override
  public List<ScoredHit> matchQuery(String collection, MatchQuery query, SearchFilter filter) {
    String[] terms = query.text().toLowerCase(Locale.ROOT).split("\\s+");
    List<ScoredHit> hits = new ArrayList<>();
    for (ClipDocument document : filtered(collection, filter)) {
      String text = document.clipText() == null ? "" : document.clipText().toLowerCase(Locale.ROOT);
      int matched = 0;
      for (String term : terms) {
        if (!term.isBlank() && text.contains(term)) {
          matched++;
        }
      }
      if (matched > 0) {
        hits.add(new ScoredHit(document.clipId(), matched, document));
      }
    }
    return top(hits, query.size());
  }

  @Override
  public List<ScoredHit> rankFusionQuery(
      String collection,
      List<KnnQuery> knnQueries,
      @Nullable MatchQuery matchQuery,
      int rankConstant,
      int size,
      SearchFilter filter) {
    if (fusionUnavailable) {
      throw new FusionUnavailableException("Rank fusion is not available");
    }
    List<List<ScoredHit>> lists = new ArrayList<>();
    for (KnnQuery knn : knnQueries) {
      lists.add(knnQuery(collection, knn, filter));
    }
    if (matchQuery != null) {
      lists.add(matchQuery(collection, matchQuery, filter));
    }
    Map<String, Double> sums = new LinkedHashMap<>();
    Map<String, ClipDocument> documents = new HashMap<>();
    for (List<ScoredHit> list : lists) {
      for (int i = 0; i < list.size(); i++) {
        ScoredHit hit = list.get(i);
        sums.merge(hit.documentId(), 1.0 / (rankConstant + i + 1), Double::sum);
        documents.putIfAbsent(hit.documentId(), hit.document());
      }
    }
    List<ScoredHit> fused = new ArrayList<>();
    sums.forEach((id, sum) -> fused.add(new ScoredHit(id, sum, documents.get(id))));
    return top(fused, size);
  }

  @Override
  public List<ClipDocument> page(String collection, @Nullable String afterClipId, int limit) {
    pageReadCalls++;
    if (rateLimitedPageReads > 0) {
      rateLimitedPageReads--;
      throw new RateLimitedException("Too many requests", new IllegalStateException("429"));
    }
    TreeMap<String, ClipDocument> documents = collection(collection);
    Map<String, ClipDocument> tail =
        afterClipId == null ? documents : documents.tailMap(afterClipId, false);
    return tail.values().stream().limit(limit).toList();
  }

  @Override
  public long count(String collection) {
    return collection(collection).size();
  }

  @Override
  public Optional<ClipDocument> findById(String collection, String clipId) {
    return Optional.ofNullable(collection(collection).get(clipId));
  }

  @Override
  public List<ClipDocument> findByVideoId(String collection, String videoId) {
    return collection(collection).values().stream()
        .filter(d -> d.videoId().equals(videoId))
        .sorted(Comparator.comparingDouble(ClipDocument::timestampStart))
        .toList();
  }

  @Override
  public List<VideoSummary> listVideos(String collection) {
    Map<String, List<ClipDocument>> byVideo = new TreeMap<>();
    for (ClipDocument d : collection(collection).values()) {
      byVideo.computeIfAbsent(d.videoId(), v -> new ArrayList<>()).add(d);
    }
    List<VideoSummary> videos = new ArrayList<>();
    byVideo.forEach(
        (videoId, clips) ->
            videos.add(
                new VideoSummary(
                    videoId, clips.get(0).videoPath(), clips.get(0).clipText(), clips.size())));
    return videos;
  }

  private TreeMap<String, ClipDocument> collection(String collection) {
    TreeMap<String, ClipDocument> documents = collections.get(collection);
    if (documents == null) {
      throw new IllegalStateException("Collection does not exist: " + collection);
    }
    return documents;
  }

  private List<ClipDocument> filtered(String collection, SearchFilter filter) {
    return collection(collection).values().stream()
        .filter(d -> filter.videoId() == null || filter.videoId().equals(d.videoId()))
        .toList();
  }

  private static List<ScoredHit> top(List<ScoredHit> hits, int limit) {
    return hits.stream()
        .sorted(
            Comparator.comparingDouble(ScoredHit::score)
                .reversed()
                .thenComparing(ScoredHit::documentId))
        .limit(limit)
        .toList();
  }

  private static ClipDocument merge(ClipDocument existing, ClipDocument incoming) {
    Map<Modality, float[]> vectors = new EnumMap<>(Modality.class);
    vectors.putAll(existing.embeddings());
    vectors.putAll(incoming.embeddings());
    return new ClipDocument(
        incoming.clipId(),
        incoming.videoId(),
        incoming.videoPath(),
        incoming.part(),
        Math.min(existing.segmentIndex(), incoming.segmentIndex()),
        incoming.timestampStart(),
        incoming.timestampEnd(),
        incoming.embeddingScope() != null ? incoming.embeddingScope() : existing.embeddingScope(),
        existing.clipText() != null ? existing.clipText() : incoming.clipText(),
        incoming.thumbnailUri() != null ? incoming.thumbnailUri() : existing.thumbnailUri(),
        vectors);
  }

  private static ClipDocument copy(
      ClipDocument d,
      @Nullable String clipText,
      @Nullable String thumbnailUri,
      Map<Modality, float[]> vectors) {
    return new ClipDocument(
        d.clipId(),
        d.videoId(),
        d.videoPath(),
        d.part(),
        d.segmentIndex(),
        d.timestampStart(),
        d.timestampEnd(),
        d.embeddingScope(),
        clipText,
        thumbnailUri,
        vectors);
  }

  private static double cosine(float[] a, float[] b) {
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      normA += a[i] * a[i];
      normB += b[i] * b[i];
    }
    return normA == 0 || normB == 0 ? 0 : dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
