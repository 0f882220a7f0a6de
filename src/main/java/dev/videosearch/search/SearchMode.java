package dev.videosearch.search;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/** Search modes accepted by the search endpoint and the MCP tool. */
public enum SearchMode {
  /** k-NN on the modality fields plus keyword match, weighted. */
  HYBRID,
  /** k-NN on every configured modality field. */
  VECTOR,
  /** Keyword match only; never needs a query embedding. */
  TEXT,
  /** k-NN on the visual field only. */
  VISUAL,
  /** k-NN on the audio field only. */
  AUDIO,
  /** k-NN on the modality fields with transcription weighted first. */
  MULTIMODAL;

  /** Wire value of the mode, as used in requests and configuration keys. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean requiresEmbedding() {
    return this != TEXT;
  }

  /**
   * Parses a wire value; null or blank means {@link #HYBRID}.
   *
   * @throws IllegalArgumentException for an unknown value
   */
  public static SearchMode fromValue(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return HYBRID;
    }
    for (SearchMode mode : values()) {
      if (mode.value().equals(value.trim().toLowerCase(Locale.ROOT))) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Invalid search_type: " + value);
  }
}
