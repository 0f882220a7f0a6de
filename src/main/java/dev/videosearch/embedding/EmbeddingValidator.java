package dev.videosearch.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * Pure static checks applied to every embedding vector before it reaches the store.
 *
 * <p>A vector is accepted only if it is a sequence of numbers of exactly the expected length, every
 * element is finite, and at least one element is non-zero. Rejections carry a reason string; values
 * are never coerced.
 */
public final class EmbeddingValidator {

  private EmbeddingValidator() {}

  /**
   * Validates a vector received as JSON.
   *
   * @param node the raw JSON value (expected to be an array of numbers)
   * @param expectedDim the dimension declared for the target field
   * @return the parsed vector, or a rejection reason
   */
  public static ValidationResult validate(@Nullable JsonNode node, int expectedDim) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return ValidationResult.rejected("Embedding is missing");
    }
    if (!node.isArray()) {
      return ValidationResult.rejected("Embedding is not a list: " + node.getNodeType());
    }
    if (node.size() != expectedDim) {
      return ValidationResult.rejected(dimensionMismatch(expectedDim, node.size()));
    }
    float[] vector = new float[node.size()];
    for (int i = 0; i < node.size(); i++) {
      JsonNode element = node.get(i);
      if (!element.isNumber()) {
        return ValidationResult.rejected(
            "Embedding contains non-numeric value at index " + i + ": " + element);
      }
      double value = element.doubleValue();
      if (!Double.isFinite(value)) {
        return ValidationResult.rejected("Embedding contains non-finite value at index " + i);
      }
      vector[i] = (float) value;
    }
    return checkContent(vector);
  }

  /**
   * Validates an already-typed vector (query embeddings, documents read back from a collection).
   *
   * @param vector the vector, possibly null
   * @param expectedDim the dimension declared for the target field
   * @return the same vector, or a rejection reason
   */
  public static ValidationResult validate(float @Nullable [] vector, int expectedDim) {
    if (vector == null) {
      return ValidationResult.rejected("Embedding is missing");
    }
    if (vector.length != expectedDim) {
      return ValidationResult.rejected(dimensionMismatch(expectedDim, vector.length));
    }
    return checkContent(vector);
  }

  private static ValidationResult checkContent(float[] vector) {
    boolean allZero = true;
    for (int i = 0; i < vector.length; i++) {
      float value = vector[i];
      if (!Float.isFinite(value)) {
        return ValidationResult.rejected("Embedding contains non-finite value at index " + i);
      }
      if (value != 0.0f) {
        allZero = false;
      }
    }
    if (allZero) {
      return ValidationResult.rejected("Embedding is all zeros");
    }
    return ValidationResult.accepted(vector);
  }

  private static String dimensionMismatch(int expected, int actual) {
    return "Embedding dimension mismatch: expected " + expected + ", got " + actual;
  }
}
