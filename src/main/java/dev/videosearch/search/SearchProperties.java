package dev.videosearch.search;

import dev.videosearch.clip.Modality;
import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the search pipeline.
 *
 * <p>Properties are bound from {@code videosearch.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code default-top-k} / {@code max-top-k} - result count when unspecified, and its upper
 *       bound (defaults 10 and 100)
 *   <li>{@code inner-top-k} - candidates fetched per k-NN sub-query before fusion (default 100)
 *   <li>{@code rrf.rank-constant} / {@code rrf.multiplier} - RRF smoothing constant and the
 *       multiplier of its theoretical maximum (defaults 60 and 1.23)
 *   <li>{@code sigmoid.steepness|scale|min-score} - logistic normalisation (5.0, 50.0, 0.5)
 *   <li>{@code presign-ttl-seconds} - lifetime of presigned URLs in results (default 3600)
 *   <li>{@code modes.<mode>} - fusion policy, per-modality weights, keyword weight and k-NN score
 *       floor of each search mode
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "videosearch.search")
public class SearchProperties {

  private int defaultTopK = 10;
  private int maxTopK = 100;
  private int innerTopK = 100;
  private long presignTtlSeconds = 3600;
  private Rrf rrf = new Rrf();
  private Sigmoid sigmoid = new Sigmoid();
  private Map<String, ModeSettings> modes = defaultModes();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (maxTopK < 1 || maxTopK > 1000) {
      throw new IllegalStateException(
          "videosearch.search.max-top-k must be in [1, 1000], got: " + maxTopK);
    }
    if (defaultTopK < 1 || defaultTopK > maxTopK) {
      throw new IllegalStateException(
          "videosearch.search.default-top-k must be in [1, max-top-k], got: " + defaultTopK);
    }
    if (innerTopK < 1 || innerTopK > 1000) {
      throw new IllegalStateException(
          "videosearch.search.inner-top-k must be in [1, 1000], got: " + innerTopK);
    }
    if (rrf.getRankConstant() < 1) {
      throw new IllegalStateException(
          "videosearch.search.rrf.rank-constant must be at least 1, got: " + rrf.getRankConstant());
    }
    if (rrf.getMultiplier() <= 0) {
      throw new IllegalStateException(
          "videosearch.search.rrf.multiplier must be positive, got: " + rrf.getMultiplier());
    }
    if (sigmoid.getMinScore() < 0.0 || sigmoid.getMinScore() > 1.0) {
      throw new IllegalStateException(
          "videosearch.search.sigmoid.min-score must be in [0.0, 1.0], got: "
              + sigmoid.getMinScore());
    }
    for (Map.Entry<String, ModeSettings> entry : modes.entrySet()) {
      SearchMode.fromValue(entry.getKey());
      for (Map.Entry<String, Double> weight : entry.getValue().getWeights().entrySet()) {
        if (Modality.fromKey(weight.getKey()).isEmpty()) {
          throw new IllegalStateException(
              "videosearch.search.modes."
                  + entry.getKey()
                  + ".weights has unknown modality: "
                  + weight.getKey());
        }
        if (weight.getValue() == null || weight.getValue() < 0.0) {
          throw new IllegalStateException(
              "videosearch.search.modes."
                  + entry.getKey()
                  + ".weights."
                  + weight.getKey()
                  + " must be non-negative");
        }
      }
    }
  }

  /**
   * Returns the settings of a mode; a mode without configuration uses pass-through with no
   * weights.
   */
  public ModeSettings mode(SearchMode mode) {
    ModeSettings settings = modes.get(mode.value());
    return settings != null ? settings : new ModeSettings();
  }

  /** Fusion parameters shared by all modes. */
  public FusionParameters fusionParameters() {
    return new FusionParameters(
        rrf.getRankConstant(),
        rrf.getMultiplier(),
        sigmoid.getSteepness(),
        sigmoid.getScale(),
        sigmoid.getMinScore());
  }

  private static Map<String, ModeSettings> defaultModes() {
    Map<String, ModeSettings> modes = new LinkedHashMap<>();
    modes.put(
        "hybrid",
        ModeSettings.of(FusionPolicy.MIN_MAX, weights("visual", 0.5, "audio", 0.3), 0.2, null));
    modes.put(
        "vector", ModeSettings.of(FusionPolicy.RRF, weights("visual", 0.6, "audio", 0.4), 0, 0.6));
    modes.put("visual", ModeSettings.of(FusionPolicy.NONE, weights("visual", 1.0), 0, 0.6));
    modes.put("audio", ModeSettings.of(FusionPolicy.NONE, weights("audio", 1.0), 0, 0.6));
    Map<String, Double> multimodal = weights("transcription", 0.5, "visual", 0.3);
    multimodal.put("audio", 0.2);
    modes.put("multimodal", ModeSettings.of(FusionPolicy.MIN_MAX, multimodal, 0, null));
    modes.put("text", ModeSettings.of(FusionPolicy.NONE, new LinkedHashMap<>(), 1.0, null));
    return modes;
  }

  private static Map<String, Double> weights(String modality, double weight) {
    Map<String, Double> weights = new LinkedHashMap<>();
    weights.put(modality, weight);
    return weights;
  }

  private static Map<String, Double> weights(
      String first, double firstWeight, String second, double secondWeight) {
    Map<String, Double> weights = weights(first, firstWeight);
    weights.put(second, secondWeight);
    return weights;
  }

  public int getDefaultTopK() {
    return defaultTopK;
  }

  public void setDefaultTopK(int defaultTopK) {
    this.defaultTopK = defaultTopK;
  }

  public int getMaxTopK() {
    return maxTopK;
  }

  public void setMaxTopK(int maxTopK) {
    this.maxTopK = maxTopK;
  }

  public int getInnerTopK() {
    return innerTopK;
  }

  public void setInnerTopK(int innerTopK) {
    this.innerTopK = innerTopK;
  }

  public long getPresignTtlSeconds() {
    return presignTtlSeconds;
  }

  public void setPresignTtlSeconds(long presignTtlSeconds) {
    this.presignTtlSeconds = presignTtlSeconds;
  }

  public Rrf getRrf() {
    return rrf;
  }

  public void setRrf(Rrf rrf) {
    this.rrf = rrf;
  }

  public Sigmoid getSigmoid() {
    return sigmoid;
  }

  public void setSigmoid(Sigmoid sigmoid) {
    this.sigmoid = sigmoid;
  }

  public Map<String, ModeSettings> getModes() {
    return modes;
  }

  public void setModes(Map<String, ModeSettings> modes) {
    this.modes = modes;
  }

  /** Reciprocal-rank fusion settings. */
  public static class Rrf {

    private int rankConstant = 60;
    private double multiplier = 1.23;

    public int getRankConstant() {
      return rankConstant;
    }

    public void setRankConstant(int rankConstant) {
      this.rankConstant = rankConstant;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }
  }

  /** Sigmoid normalisation settings. */
  public static class Sigmoid {

    private double steepness = 5.0;
    private double scale = 50.0;
    private double minScore = 0.5;

    public double getSteepness() {
      return steepness;
    }

    public void setSteepness(double steepness) {
      this.steepness = steepness;
    }

    public double getScale() {
      return scale;
    }

    public void setScale(double scale) {
      this.scale = scale;
    }

    public double getMinScore() {
      return minScore;
    }

    public void setMinScore(double minScore) {
      this.minScore = minScore;
    }
  }

  /**
   * Sub-query composition and fusion of one search mode. Weight keys are modality names; their
   * iteration order is the order of the k-NN sub-queries.
   */
  public static class ModeSettings {

    private FusionPolicy policy = FusionPolicy.NONE;
    private Map<String, Double> weights = new LinkedHashMap<>();
    private double keywordWeight;
    private @Nullable Double minScore;

    static ModeSettings of(
        FusionPolicy policy,
        Map<String, Double> weights,
        double keywordWeight,
        @Nullable Double minScore) {
      ModeSettings settings = new ModeSettings();
      settings.setPolicy(policy);
      settings.setWeights(weights);
      settings.setKeywordWeight(keywordWeight);
      settings.setMinScore(minScore);
      return settings;
    }

    public FusionPolicy getPolicy() {
      return policy;
    }

    public void setPolicy(FusionPolicy policy) {
      this.policy = policy;
    }

    public Map<String, Double> getWeights() {
      return weights;
    }

    public void setWeights(Map<String, Double> weights) {
      this.weights = weights;
    }

    public double getKeywordWeight() {
      return keywordWeight;
    }

    public void setKeywordWeight(double keywordWeight) {
      this.keywordWeight = keywordWeight;
    }

    public @Nullable Double getMinScore() {
      return minScore;
    }

    public void setMinScore(@Nullable Double minScore) {
      this.minScore = minScore;
    }
  }
}
