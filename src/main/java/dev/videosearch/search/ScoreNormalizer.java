package dev.videosearch.search;

/**
 * Pure static score normalisation functions used by {@link FusionEngine}.
 *
 * <p>Each function rescales one sub-query's raw scores, which live on an engine-dependent scale,
 * onto a scale where scores of different sub-queries can be combined.
 */
public final class ScoreNormalizer {

  private ScoreNormalizer() {}

  /**
   * Min-max rescaling to [0, 1]: {@code (s - min) / (max - min)}. When all scores are equal the
   * denominator is 1, so every score maps to 0.
   */
  public static double[] minMax(double[] scores) {
    if (scores.length == 0) {
      return new double[0];
    }
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double score : scores) {
      min = Math.min(min, score);
      max = Math.max(max, score);
    }
    double range = max - min;
    if (range == 0.0) {
      range = 1.0;
    }
    double[] normalised = new double[scores.length];
    for (int i = 0; i < scores.length; i++) {
      normalised[i] = (scores[i] - min) / range;
    }
    return normalised;
  }

  /** Division by the Euclidean norm of the list; a zero norm is replaced by 1. */
  public static double[] l2(double[] scores) {
    double sumOfSquares = 0.0;
    for (double score : scores) {
      sumOfSquares += score * score;
    }
    double norm = Math.sqrt(sumOfSquares);
    if (norm == 0.0) {
      norm = 1.0;
    }
    double[] normalised = new double[scores.length];
    for (int i = 0; i < scores.length; i++) {
      normalised[i] = scores[i] / norm;
    }
    return normalised;
  }

  /**
   * Logistic rescaling around the list mean: {@code 1 / (1 + e^(-steepness * (s - mean) *
   * scale))}. Output lies in (0, 1); the mean maps to 0.5.
   */
  public static double[] sigmoid(double[] scores, double steepness, double scale) {
    if (scores.length == 0) {
      return new double[0];
    }
    double sum = 0.0;
    for (double score : scores) {
      sum += score;
    }
    double mean = sum / scores.length;
    double[] normalised = new double[scores.length];
    for (int i = 0; i < scores.length; i++) {
      normalised[i] = 1.0 / (1.0 + Math.exp(-steepness * (scores[i] - mean) * scale));
    }
    return normalised;
  }

  /**
   * Maps a raw reciprocal-rank fusion score into [0, 1] by dividing it by {@code multiplier / (k +
   * 1)} and clamping to 1. Non-decreasing in {@code rawScore}.
   */
  public static double normalizeRrf(double rawScore, int rankConstant, double multiplier) {
    double theoreticalMax = multiplier / (rankConstant + 1);
    return Math.min(1.0, Math.max(0.0, rawScore) / theoreticalMax);
  }
}
