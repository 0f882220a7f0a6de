package dev.videosearch.clip;

import java.util.Locale;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Embedding modality of a clip. Each modality is stored in its own vector field; the field name,
 * dimension and metric come from {@code videosearch.index.fields.<modality>}.
 */
public enum Modality {
  VISUAL,
  AUDIO,
  TRANSCRIPTION;

  /** Lowercase key used in configuration and sub-query labels. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Parses a modality key such as {@code visual}; empty when the key names no modality. */
  public static Optional<Modality> fromKey(@Nullable String key) {
    if (key == null) {
      return Optional.empty();
    }
    for (Modality modality : values()) {
      if (modality.key().equals(key.trim().toLowerCase(Locale.ROOT))) {
        return Optional.of(modality);
      }
    }
    return Optional.empty();
  }

  /**
   * Maps an embedding scope produced by the embedding model to the modality field it feeds.
   *
   * <p>{@code clip}, {@code visual}, {@code visual-text} and {@code visual-image} feed the visual
   * field; {@code audio} the audio field; {@code transcription} the transcription field. A null or
   * blank scope is treated as {@code clip}.
   *
   * @param embeddingScope scope string as emitted in the embedding payload
   * @return the modality, or empty for an unknown scope
   */
  public static Optional<Modality> fromScope(@Nullable String embeddingScope) {
    if (embeddingScope == null || embeddingScope.isBlank()) {
      return Optional.of(VISUAL);
    }
    return switch (embeddingScope.trim().toLowerCase(Locale.ROOT)) {
      case "clip", "visual", "visual-text", "visual-image" -> Optional.of(VISUAL);
      case "audio" -> Optional.of(AUDIO);
      case "transcription" -> Optional.of(TRANSCRIPTION);
      default -> Optional.empty();
    };
  }
}
