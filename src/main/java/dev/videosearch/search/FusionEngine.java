package dev.videosearch.search;

import dev.videosearch.clip.ClipDocument;
import dev.videosearch.store.ScoredHit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Pure static utility combining the scored lists of several sub-queries into one ranking.
 *
 * <p>Raw scores of different sub-queries are not comparable (k-NN similarities and keyword
 * relevance live on different scales), so every policy except {@link FusionPolicy#NONE} first
 * brings each list onto a common scale. Documents returned by several sub-queries appear once.
 * Documents with equal fused scores keep the order in which they were first seen, walking the
 * lists in sub-query order.
 *
 * <p>This class has no Spring dependencies and no state.
 */
public final class FusionEngine {

  private FusionEngine() {}

  /**
   * Fuses sub-query result lists under a policy.
   *
   * <ul>
   *   <li>{@code NONE}: hits pass through in list order, first occurrence wins
   *   <li>{@code MIN_MAX}, {@code L2}: each list normalised, then {@code sum(weight * norm)}; a
   *       document missing from a list contributes 0 for it
   *   <li>{@code SIGMOID}: each list normalised and sorted, cut at the first score below the
   *       minimum, then the highest contribution per document is kept; weights do not apply
   *   <li>{@code RRF}: {@code sum(1 / (k + rank))} over the lists (1-based ranks), unweighted,
   *       then re-normalised with {@link ScoreNormalizer#normalizeRrf}
   * </ul>
   *
   * @param lists sub-query results in plan order
   * @param policy the fusion policy
   * @param parameters normalisation constants
   * @param topK maximum number of fused hits
   * @return fused hits, best first, at most {@code topK}
   */
  public static List<FusedHit> fuse(
      List<RankedList> lists, FusionPolicy policy, FusionParameters parameters, int topK) {
    if (lists.isEmpty() || topK < 1) {
      return List.of();
    }
    Map<String, Accumulator> fused =
        switch (policy) {
          case NONE -> passThrough(lists);
          case MIN_MAX -> weighted(lists, ScoreNormalizer::minMax);
          case L2 -> weighted(lists, ScoreNormalizer::l2);
          case SIGMOID -> sigmoid(lists, parameters);
          case RRF -> reciprocalRank(lists, parameters.rankConstant());
        };
    List<Accumulator> ranked = new ArrayList<>(fused.values());
    // List.sort is stable: equal scores keep first-seen order
    ranked.sort(Comparator.comparingDouble(Accumulator::score).reversed());
    List<FusedHit> result = new ArrayList<>(Math.min(topK, ranked.size()));
    for (Accumulator entry : ranked) {
      if (result.size() == topK) {
        break;
      }
      double score =
          policy == FusionPolicy.RRF
              ? ScoreNormalizer.normalizeRrf(
                  entry.score, parameters.rankConstant(), parameters.rrfMultiplier())
              : entry.score;
      result.add(new FusedHit(entry.documentId, score, entry.document, entry.rawScores));
    }
    return result;
  }

  /**
   * Re-normalises hits whose scores are raw RRF sums computed by the store. Store order is kept.
   */
  public static List<FusedHit> normalizeRankFusion(
      List<ScoredHit> hits, FusionParameters parameters, int topK) {
    List<FusedHit> result = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (ScoredHit hit : hits) {
      if (result.size() == topK) {
        break;
      }
      if (!seen.add(hit.documentId())) {
        continue;
      }
      double score =
          ScoreNormalizer.normalizeRrf(
              hit.score(), parameters.rankConstant(), parameters.rrfMultiplier());
      result.add(new FusedHit(hit.documentId(), score, hit.document(), Map.of("rrf", hit.score())));
    }
    return result;
  }

  private static Map<String, Accumulator> passThrough(List<RankedList> lists) {
    Map<String, Accumulator> fused = new LinkedHashMap<>();
    for (RankedList list : lists) {
      for (ScoredHit hit : list.hits()) {
        Accumulator entry = fused.get(hit.documentId());
        if (entry == null) {
          entry = new Accumulator(hit.documentId(), hit.score());
          fused.put(hit.documentId(), entry);
        }
        entry.record(list.label(), hit);
      }
    }
    return fused;
  }

  private static Map<String, Accumulator> weighted(
      List<RankedList> lists, Function<double[], double[]> normaliser) {
    Map<String, Accumulator> fused = new LinkedHashMap<>();
    for (RankedList list : lists) {
      List<ScoredHit> hits = distinct(list.hits());
      double[] normalised = normaliser.apply(rawScores(hits));
      for (int i = 0; i < hits.size(); i++) {
        ScoredHit hit = hits.get(i);
        Accumulator entry = fused.computeIfAbsent(hit.documentId(), id -> new Accumulator(id, 0.0));
        entry.score += list.weight() * normalised[i];
        entry.record(list.label(), hit);
      }
    }
    return fused;
  }

  private static Map<String, Accumulator> sigmoid(
      List<RankedList> lists, FusionParameters parameters) {
    Map<String, Accumulator> fused = new LinkedHashMap<>();
    for (RankedList list : lists) {
      List<ScoredHit> hits = distinct(list.hits());
      double[] normalised =
          ScoreNormalizer.sigmoid(
              rawScores(hits), parameters.sigmoidSteepness(), parameters.sigmoidScale());
      List<Integer> order = new ArrayList<>(hits.size());
      for (int i = 0; i < hits.size(); i++) {
        order.add(i);
      }
      // the threshold cut below relies on descending order
      order.sort(Comparator.comparingDouble((Integer i) -> normalised[i]).reversed());
      for (int i : order) {
        if (normalised[i] < parameters.sigmoidMinScore()) {
          break;
        }
        ScoredHit hit = hits.get(i);
        Accumulator entry = fused.get(hit.documentId());
        if (entry == null) {
          entry = new Accumulator(hit.documentId(), normalised[i]);
          fused.put(hit.documentId(), entry);
        } else if (normalised[i] > entry.score) {
          entry.score = normalised[i];
        }
        entry.record(list.label(), hit);
      }
    }
    return fused;
  }

  private static Map<String, Accumulator> reciprocalRank(List<RankedList> lists, int rankConstant) {
    Map<String, Accumulator> fused = new LinkedHashMap<>();
    for (RankedList list : lists) {
      List<ScoredHit> hits = distinct(list.hits());
      for (int i = 0; i < hits.size(); i++) {
        ScoredHit hit = hits.get(i);
        Accumulator entry = fused.computeIfAbsent(hit.documentId(), id -> new Accumulator(id, 0.0));
        entry.score += 1.0 / (rankConstant + i + 1);
        entry.record(list.label(), hit);
      }
    }
    return fused;
  }

  /** Drops repeated documents within one list, keeping the first (best) occurrence. */
  private static List<ScoredHit> distinct(List<ScoredHit> hits) {
    Set<String> seen = new HashSet<>();
    List<ScoredHit> distinct = new ArrayList<>(hits.size());
    for (ScoredHit hit : hits) {
      if (seen.add(hit.documentId())) {
        distinct.add(hit);
      }
    }
    return distinct;
  }

  private static double[] rawScores(List<ScoredHit> hits) {
    double[] scores = new double[hits.size()];
    for (int i = 0; i < hits.size(); i++) {
      scores[i] = hits.get(i).score();
    }
    return scores;
  }

  /** Mutable holder for one document during fusion. */
  private static final class Accumulator {

    private final String documentId;
    private double score;
    private @Nullable ClipDocument document;
    private final Map<String, Double> rawScores = new LinkedHashMap<>();

    Accumulator(String documentId, double score) {
      this.documentId = documentId;
      this.score = score;
    }

    double score() {
      return score;
    }

    void record(String label, ScoredHit hit) {
      rawScores.putIfAbsent(label, hit.score());
      if (document == null) {
        document = hit.document();
      }
    }
  }
}
