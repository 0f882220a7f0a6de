package dev.videosearch.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

import dev.videosearch.BaseIntegrationTest;
import dev.videosearch.clip.ClipDocument;
import dev.videosearch.clip.Modality;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class PgVectorClipIndexStoreIT extends BaseIntegrationTest {

  @Autowired ClipIndexStore store;

  IndexSchema schema;
  String collection;

  @BeforeEach
  void setUp() {
    schema = schemaManager.defaultSchema();
    collection = schema.collection();
  }

  @Test
  void upsertMergesModalitiesAndKeepsClipText() {
    store.upsert(collection, clip("clip_a", "video-1", 0.0, "harbour at dusk", vector(0), null));
    store.upsert(
        collection,
        document("clip_a", "video-1", 0.0, "other text", Map.of(Modality.AUDIO, vector(1))));

    ClipDocument stored = store.findById(collection, "clip_a").orElseThrow();
    assertThat(stored.clipText()).isEqualTo("harbour at dusk");
    assertThat(stored.embeddings()).containsOnlyKeys(Modality.VISUAL, Modality.AUDIO);
    assertThat(stored.embedding(Modality.AUDIO)[1]).isEqualTo(1.0f);
  }

  @Test
  void knnRanksBySimilarityAndAppliesScoreFloor() {
    store.upsert(collection, clip("clip_a", "video-1", 0.0, "a", vector(0), null));
    store.upsert(collection, clip("clip_b", "video-1", 6.0, "b", vector(0, 1, 1.0f), null));
    store.upsert(collection, clip("clip_c", "video-1", 12.0, "c", vector(1), null));
    VectorFieldSpec visual = schema.field(Modality.VISUAL);

    List<ScoredHit> hits =
        store.knnQuery(collection, new KnnQuery(visual, vector(0), 10, 0.6), SearchFilter.none());

    assertThat(hits).extracting(ScoredHit::documentId).containsExactly("clip_a", "clip_b");
    assertThat(hits.get(0).score()).isCloseTo(1.0, offset(1e-6));
    assertThat(hits.get(1).score()).isCloseTo((1 + Math.sqrt(0.5)) / 2, offset(1e-6));
  }

  @Test
  void knnHonoursVideoFilter() {
    store.upsert(collection, clip("clip_a", "video-1", 0.0, "a", vector(0), null));
    store.upsert(collection, clip("clip_b", "video-2", 0.0, "b", vector(0), null));

    List<ScoredHit> hits =
        store.knnQuery(
            collection,
            new KnnQuery(schema.field(Modality.VISUAL), vector(0), 10, null),
            SearchFilter.forVideo("video-2"));

    assertThat(hits).extracting(ScoredHit::documentId).containsExactly("clip_b");
  }

  @Test
  void matchUsesFullTextRelevance() {
    store.upsert(
        collection, clip("clip_a", "video-1", 0.0, "red boats leave the harbour", vector(0), null));
    store.upsert(collection, clip("clip_b", "video-1", 6.0, "a quiet forest", vector(1), null));

    List<ScoredHit> hits =
        store.matchQuery(collection, new MatchQuery("boat harbour", 10), SearchFilter.none());

    assertThat(hits).extracting(ScoredHit::documentId).containsExactly("clip_a");
    assertThat(hits.get(0).score()).isPositive();
    assertThat(hits.get(0).document().clipText()).isEqualTo("red boats leave the harbour");
  }

  @Test
  void rankFusionSumsReciprocalRanks() {
    store.upsert(
        collection, document("clip_a", "video-1", 0.0, "harbour", vectors(vector(0), vector(1))));
    store.upsert(
        collection,
        document(
            "clip_b", "video-1", 6.0, "forest", vectors(vector(0, 2, 2.0f), vector(1, 2, 2.0f))));

    List<ScoredHit> hits =
        store.rankFusionQuery(
            collection,
            List.of(
                new KnnQuery(schema.field(Modality.VISUAL), vector(0), 10, null),
                new KnnQuery(schema.field(Modality.AUDIO), vector(1), 10, null)),
            new MatchQuery("harbour", 10),
            60,
            10,
            SearchFilter.none());

    assertThat(hits).extracting(ScoredHit::documentId).containsExactly("clip_a", "clip_b");
    assertThat(hits.get(0).score()).isCloseTo(3.0 / 61, offset(1e-9));
    assertThat(hits.get(1).score()).isCloseTo(2.0 / 62, offset(1e-9));
  }

  @Test
  void updatesReportMissingClips() {
    store.upsert(collection, clip("clip_a", "video-1", 0.0, "a", vector(0), null));

    assertThat(store.updateThumbnail(collection, "clip_a", "s3://thumbs/a.jpg")).isTrue();
    assertThat(store.updateClipText(collection, "clip_a", "new text")).isTrue();
    assertThat(store.updateThumbnail(collection, "missing", "s3://thumbs/x.jpg")).isFalse();

    ClipDocument stored = store.findById(collection, "clip_a").orElseThrow();
    assertThat(stored.thumbnailUri()).isEqualTo("s3://thumbs/a.jpg");
    assertThat(stored.clipText()).isEqualTo("new text");
  }

  @Test
  void listsVideosAndDeletesByVideo() {
    store.upsert(collection, clip("clip_a", "video-1", 6.0, "second", vector(0), null));
    store.upsert(collection, clip("clip_b", "video-1", 0.0, "first", vector(0), null));
    store.upsert(collection, clip("clip_c", "video-2", 0.0, null, vector(0), null));

    List<VideoSummary> videos = store.listVideos(collection);

    assertThat(videos).extracting(VideoSummary::videoId).containsExactly("video-1", "video-2");
    assertThat(videos.get(0).title()).isEqualTo("first");
    assertThat(videos.get(0).clipCount()).isEqualTo(2);
    assertThat(videos.get(1).title()).isNull();

    assertThat(store.deleteByVideoId(collection, "video-1")).isEqualTo(2);
    assertThat(store.count(collection)).isEqualTo(1);
    assertThat(store.findByVideoId(collection, "video-1")).isEmpty();
  }

  @Test
  void pagesInClipIdOrderWithVectors() {
    List<String> ids = List.of("clip_c", "clip_a", "clip_b");
    for (int i = 0; i < ids.size(); i++) {
      store.upsert(collection, clip(ids.get(i), "video-1", i * 6.0, "x", vector(0), null));
    }

    List<ClipDocument> first = store.page(collection, null, 2);
    List<ClipDocument> second = store.page(collection, first.get(1).clipId(), 2);

    assertThat(first).extracting(ClipDocument::clipId).containsExactly("clip_a", "clip_b");
    assertThat(second).extracting(ClipDocument::clipId).containsExactly("clip_c");
    assertThat(second.get(0).embedding(Modality.VISUAL)).hasSize(DIMENSION);
  }

  @Test
  void bulkUpsertReportsEveryItem() {
    List<BulkItemOutcome> outcomes =
        store.bulkUpsert(
            collection,
            List.of(
                clip("clip_a", "video-1", 0.0, "a", vector(0), null),
                clip("clip_b", "video-1", 6.0, "b", vector(1), null)));

    assertThat(outcomes).allMatch(BulkItemOutcome::created);
    assertThat(store.count(collection)).isEqualTo(2);
  }

  @Test
  void missingCollectionCountsZero() {
    assertThat(store.exists("no_such_collection")).isFalse();
    assertThat(store.count("no_such_collection")).isZero();
  }

  @Test
  void changedDimensionIsRefused() {
    jdbcTemplate.execute("DROP TABLE IF EXISTS clips_dim_check");
    IndexSchema original = schema.forCollection("clips_dim_check");
    store.ensureSchema(original);
    IndexSchema resized =
        new IndexSchema(
            "clips_dim_check",
            List.of(new VectorFieldSpec(Modality.VISUAL, "emb_visual", 1024, DistanceMetric.COSINE)),
            schema.keywordField(),
            schema.textSearchConfig());

    assertThatThrownBy(() -> store.ensureSchema(resized))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("vector(512)");
  }

  private static ClipDocument clip(
      String clipId, String videoId, double start, String text, float[] visual, String thumbnail) {
    return new ClipDocument(
        clipId, videoId, "s3://videos/" + videoId + ".mp4", 0, 0, start, start + 6.0, "visual-text",
        text, thumbnail, Map.of(Modality.VISUAL, visual));
  }

  private static ClipDocument document(
      String clipId, String videoId, double start, String text, Map<Modality, float[]> vectors) {
    return new ClipDocument(
        clipId, videoId, "s3://videos/" + videoId + ".mp4", 0, 0, start, start + 6.0, null, text,
        null, vectors);
  }

  private static Map<Modality, float[]> vectors(float[] visual, float[] audio) {
    Map<Modality, float[]> vectors = new EnumMap<>(Modality.class);
    vectors.put(Modality.VISUAL, visual);
    vectors.put(Modality.AUDIO, audio);
    return vectors;
  }
}
