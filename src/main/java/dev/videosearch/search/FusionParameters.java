package dev.videosearch.search;

/**
 * Constants of the normalisation policies.
 *
 * @param rankConstant RRF smoothing constant {@code k}
 * @param rrfMultiplier multiplier of the theoretical RRF maximum {@code 1 / (k + 1)}
 * @param sigmoidSteepness steepness of the logistic curve
 * @param sigmoidScale fixed multiplier applied to the centred score
 * @param sigmoidMinScore normalised scores below this are dropped
 */
public record FusionParameters(
    int rankConstant,
    double rrfMultiplier,
    double sigmoidSteepness,
    double sigmoidScale,
    double sigmoidMinScore) {

  /** The defaults used when nothing is configured. */
  public static FusionParameters defaults() {
    return new FusionParameters(60, 1.23, 5.0, 50.0, 0.5);
  }
}
