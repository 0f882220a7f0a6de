package dev.videosearch.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.videosearch.store.ScoredHit;
import java.util.List;
import org.junit.jupiter.api.Test;

class FusionEngineTest {

  private static final FusionParameters PARAMS = FusionParameters.defaults();

  @Test
  void minMaxFusionSumsWeightedNormalisedScores() {
    RankedList visual =
        new RankedList("knn:visual", 0.6, List.of(hit("A", 0.9), hit("X", 0.8), hit("B", 0.5)));
    RankedList audio =
        new RankedList("knn:audio", 0.4, List.of(hit("C", 0.7), hit("X", 0.6), hit("D", 0.2)));

    List<FusedHit> fused = FusionEngine.fuse(List.of(visual, audio), FusionPolicy.MIN_MAX, PARAMS, 5);

    double expectedX = 0.6 * ((0.8 - 0.5) / (0.9 - 0.5)) + 0.4 * ((0.6 - 0.2) / (0.7 - 0.2));
    assertThat(fused).extracting(FusedHit::documentId).containsExactly("X", "A", "C", "B", "D");
    assertThat(fused.get(0).score()).isCloseTo(expectedX, within(1e-12));
    assertThat(fused.get(1).score()).isCloseTo(0.6, within(1e-12));
    assertThat(fused.get(2).score()).isCloseTo(0.4, within(1e-12));
    assertThat(fused.get(0).rawScores()).containsEntry("knn:visual", 0.8).containsEntry("knn:audio", 0.6);
  }

  @Test
  void weightsAreNotRenormalisedByTheirSum() {
    RankedList first = new RankedList("knn:visual", 0.6, List.of(hit("X", 1.0), hit("Y", 0.0)));
    RankedList second = new RankedList("knn:audio", 0.6, List.of(hit("X", 1.0), hit("Y", 0.0)));

    List<FusedHit> fused =
        FusionEngine.fuse(List.of(first, second), FusionPolicy.MIN_MAX, PARAMS, 10);

    assertThat(fused.get(0).score()).isCloseTo(1.2, within(1e-12));
  }

  @Test
  void resultIsCutAtTopK() {
    RankedList list =
        new RankedList("knn:visual", 1.0, List.of(hit("A", 0.9), hit("B", 0.8), hit("C", 0.7)));

    assertThat(FusionEngine.fuse(List.of(list), FusionPolicy.MIN_MAX, PARAMS, 2))
        .extracting(FusedHit::documentId)
        .containsExactly("A", "B");
  }

  @Test
  void equalScoresKeepFirstSeenOrder() {
    RankedList visual = new RankedList("knn:visual", 0.5, List.of(hit("A", 1.0), hit("B", 0.0)));
    RankedList audio = new RankedList("knn:audio", 0.5, List.of(hit("C", 1.0), hit("D", 0.0)));

    List<FusedHit> fused = FusionEngine.fuse(List.of(visual, audio), FusionPolicy.MIN_MAX, PARAMS, 4);

    assertThat(fused).extracting(FusedHit::documentId).containsExactly("A", "C", "B", "D");
  }

  @Test
  void duplicateWithinOneListCountsOnce() {
    RankedList list =
        new RankedList("knn:visual", 1.0, List.of(hit("A", 0.9), hit("A", 0.3), hit("B", 0.5)));

    List<FusedHit> fused = FusionEngine.fuse(List.of(list), FusionPolicy.MIN_MAX, PARAMS, 10);

    assertThat(fused).extracting(FusedHit::documentId).containsExactly("A", "B");
    assertThat(fused.get(0).score()).isEqualTo(1.0);
  }

  @Test
  void passThroughKeepsStoreOrderAndScores() {
    RankedList list =
        new RankedList("match", 1.0, List.of(hit("A", 7.5), hit("B", 2.0), hit("C", 1.0)));

    List<FusedHit> fused = FusionEngine.fuse(List.of(list), FusionPolicy.NONE, PARAMS, 10);

    assertThat(fused).extracting(FusedHit::documentId).containsExactly("A", "B", "C");
    assertThat(fused).extracting(FusedHit::score).containsExactly(7.5, 2.0, 1.0);
  }

  @Test
  void l2FusionUsesNormDivision() {
    RankedList list = new RankedList("knn:visual", 0.5, List.of(hit("A", 3.0), hit("B", 4.0)));

    List<FusedHit> fused = FusionEngine.fuse(List.of(list), FusionPolicy.L2, PARAMS, 10);

    assertThat(fused).extracting(FusedHit::documentId).containsExactly("B", "A");
    assertThat(fused.get(0).score()).isCloseTo(0.4, within(1e-12));
    assertThat(fused.get(1).score()).isCloseTo(0.3, within(1e-12));
  }

  @Test
  void rrfSumsReciprocalRanksAndNormalises() {
    RankedList visual = new RankedList("knn:visual", 0.6, List.of(hit("A", 0.9), hit("B", 0.8)));
    RankedList audio = new RankedList("knn:audio", 0.4, List.of(hit("B", 0.7), hit("C", 0.1)));

    List<FusedHit> fused = FusionEngine.fuse(List.of(visual, audio), FusionPolicy.RRF, PARAMS, 10);

    double max = 1.23 / 61;
    assertThat(fused).extracting(FusedHit::documentId).containsExactly("B", "A", "C");
    assertThat(fused.get(0).score()).isEqualTo(1.0);
    assertThat(fused.get(1).score()).isCloseTo((1.0 / 61) / max, within(1e-12));
    assertThat(fused.get(2).score()).isCloseTo((1.0 / 62) / max, within(1e-12));
  }

  @Test
  void sigmoidSortsBeforeCuttingAtMinimum() {
    // unsorted input: the best hit comes last
    RankedList list =
        new RankedList(
            "knn:visual", 1.0, List.of(hit("low", 0.40), hit("mid", 0.55), hit("high", 0.60)));

    List<FusedHit> fused = FusionEngine.fuse(List.of(list), FusionPolicy.SIGMOID, PARAMS, 10);

    assertThat(fused).extracting(FusedHit::documentId).containsExactly("high", "mid");
    assertThat(fused.get(1).score()).isGreaterThan(0.99);
  }

  @Test
  void sigmoidKeepsHighestContributionPerDocument() {
    RankedList visual =
        new RankedList("knn:visual", 0.6, List.of(hit("X", 0.9), hit("Y", 0.1)));
    RankedList audio = new RankedList("knn:audio", 0.4, List.of(hit("X", 0.5), hit("Z", 0.5)));

    List<FusedHit> fused = FusionEngine.fuse(List.of(visual, audio), FusionPolicy.SIGMOID, PARAMS, 10);

    double visualTop = 1.0 / (1.0 + Math.exp(-5.0 * (0.9 - 0.5) * 50.0));
    assertThat(fused.get(0).documentId()).isEqualTo("X");
    assertThat(fused.get(0).score()).isCloseTo(visualTop, within(1e-12));
    assertThat(fused).extracting(FusedHit::documentId).doesNotContain("Y");
  }

  @Test
  void storeRankFusionScoresAreRenormalised() {
    List<ScoredHit> hits = List.of(hit("A", 2.0 / 61), hit("B", 1.0 / 61), hit("A", 1.0 / 70));

    List<FusedHit> fused = FusionEngine.normalizeRankFusion(hits, PARAMS, 10);

    assertThat(fused).extracting(FusedHit::documentId).containsExactly("A", "B");
    assertThat(fused.get(0).score()).isEqualTo(1.0);
    assertThat(fused.get(1).score()).isCloseTo((1.0 / 61) / (1.23 / 61), within(1e-12));
    assertThat(fused.get(1).rawScores()).containsEntry("rrf", 1.0 / 61);
  }

  @Test
  void noListsGiveNoHits() {
    assertThat(FusionEngine.fuse(List.of(), FusionPolicy.MIN_MAX, PARAMS, 10)).isEmpty();
  }

  private static ScoredHit hit(String id, double score) {
    return new ScoredHit(id, score, null);
  }
}
