package dev.videosearch.search;

/**
 * How the scored lists of a multi-sub-query search are combined into one ranking. Selected per
 * search mode by configuration.
 */
public enum FusionPolicy {
  /** Lists pass through unchanged; duplicates keep their first occurrence. */
  NONE,
  /** Min-max rescaling per list, then weighted sum. */
  MIN_MAX,
  /** Division by each list's Euclidean norm, then weighted sum. */
  L2,
  /** Logistic rescaling around each list's mean, thresholded, best contribution per document. */
  SIGMOID,
  /** Reciprocal-rank fusion, re-normalised into [0, 1]. */
  RRF
}
