package dev.videosearch.store;

import dev.videosearch.clip.Modality;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration of the clip collection, bound from {@code videosearch.index.*}.
 *
 * <ul>
 *   <li>{@code collection} - collection name (default {@code video_clips})
 *   <li>{@code fields.<modality>.name|dimension|metric} - one vector field per modality (defaults
 *       {@code emb_visual}, {@code emb_audio}, {@code emb_transcription}; 512; COSINE)
 *   <li>{@code keyword-field} - keyword field name (default {@code clip_text})
 *   <li>{@code text-search-config} - full-text configuration of the keyword field (default {@code
 *       english})
 *   <li>{@code native-rank-fusion} - whether the store computes RRF server-side (default true)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "videosearch.index")
public class IndexProperties {

  private static final Set<Integer> SUPPORTED_DIMENSIONS = Set.of(384, 512, 1024);
  private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

  private String collection = "video_clips";
  private String keywordField = "clip_text";
  private String textSearchConfig = "english";
  private boolean nativeRankFusion = true;
  private Fields fields = new Fields();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    requireIdentifier("videosearch.index.collection", collection);
    requireIdentifier("videosearch.index.keyword-field", keywordField);
    requireIdentifier("videosearch.index.text-search-config", textSearchConfig);
    Integer dimension = null;
    for (VectorFieldSpec spec : toSchema().vectorFields()) {
      String prefix = "videosearch.index.fields." + spec.modality().key();
      requireIdentifier(prefix + ".name", spec.name());
      if (!SUPPORTED_DIMENSIONS.contains(spec.dimension())) {
        throw new IllegalStateException(
            prefix + ".dimension must be one of 384, 512, 1024, got: " + spec.dimension());
      }
      if (dimension != null && dimension != spec.dimension()) {
        throw new IllegalStateException(
            "All vector fields must share one dimension, got " + dimension + " and "
                + spec.dimension());
      }
      dimension = spec.dimension();
    }
  }

  private static void requireIdentifier(String property, String value) {
    if (value == null || !IDENTIFIER.matcher(value).matches()) {
      throw new IllegalStateException(
          property + " must be a lowercase identifier, got: " + value);
    }
  }

  /** Builds the schema of the configured collection. */
  public IndexSchema toSchema() {
    List<VectorFieldSpec> specs = new ArrayList<>();
    specs.add(fields.getVisual().toSpec(Modality.VISUAL));
    specs.add(fields.getAudio().toSpec(Modality.AUDIO));
    specs.add(fields.getTranscription().toSpec(Modality.TRANSCRIPTION));
    return new IndexSchema(collection, specs, keywordField, textSearchConfig);
  }

  public String getCollection() {
    return collection;
  }

  public void setCollection(String collection) {
    this.collection = collection;
  }

  public String getKeywordField() {
    return keywordField;
  }

  public void setKeywordField(String keywordField) {
    this.keywordField = keywordField;
  }

  public String getTextSearchConfig() {
    return textSearchConfig;
  }

  public void setTextSearchConfig(String textSearchConfig) {
    this.textSearchConfig = textSearchConfig;
  }

  public boolean isNativeRankFusion() {
    return nativeRankFusion;
  }

  public void setNativeRankFusion(boolean nativeRankFusion) {
    this.nativeRankFusion = nativeRankFusion;
  }

  public Fields getFields() {
    return fields;
  }

  public void setFields(Fields fields) {
    this.fields = fields;
  }

  /** The three modality fields. */
  public static class Fields {

    private Field visual = new Field("emb_visual");
    private Field audio = new Field("emb_audio");
    private Field transcription = new Field("emb_transcription");

    public Field getVisual() {
      return visual;
    }

    public void setVisual(Field visual) {
      this.visual = visual;
    }

    public Field getAudio() {
      return audio;
    }

    public void setAudio(Field audio) {
      this.audio = audio;
    }

    public Field getTranscription() {
      return transcription;
    }

    public void setTranscription(Field transcription) {
      this.transcription = transcription;
    }
  }

  /** One vector field. */
  public static class Field {

    private String name;
    private int dimension = 512;
    private DistanceMetric metric = DistanceMetric.COSINE;

    public Field() {
      this("");
    }

    Field(String name) {
      this.name = name;
    }

    VectorFieldSpec toSpec(Modality modality) {
      return new VectorFieldSpec(modality, name, dimension, metric);
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public int getDimension() {
      return dimension;
    }

    public void setDimension(int dimension) {
      this.dimension = dimension;
    }

    public DistanceMetric getMetric() {
      return metric;
    }

    public void setMetric(DistanceMetric metric) {
      this.metric = metric;
    }
  }
}
