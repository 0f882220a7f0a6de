package dev.videosearch.embedding;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of {@link EmbeddingValidator}: either the accepted vector or a rejection reason.
 *
 * @param accepted whether the vector may be admitted to the store
 * @param vector the parsed vector (only when accepted)
 * @param reason human-readable rejection reason (only when rejected)
 */
public record ValidationResult(boolean accepted, float @Nullable [] vector, @Nullable String reason) {

  public static ValidationResult accepted(float[] vector) {
    return new ValidationResult(true, vector, null);
  }

  public static ValidationResult rejected(String reason) {
    return new ValidationResult(false, null, reason);
  }

  /**
   * Returns the accepted vector.
   *
   * @throws IllegalStateException if the result is a rejection
   */
  public float[] requireVector() {
    if (!accepted || vector == null) {
      throw new IllegalStateException("Embedding was rejected: " + reason);
    }
    return vector;
  }
}
