package dev.videosearch.store;

import org.jspecify.annotations.Nullable;

/**
 * Nearest-neighbour query on one vector field.
 *
 * @param field the field to search
 * @param vector query vector, of the field's dimension
 * @param k candidate count
 * @param minScore hits scoring below this floor are discarded by the store
 */
public record KnnQuery(VectorFieldSpec field, float[] vector, int k, @Nullable Double minScore) {

  public KnnQuery {
    if (vector.length != field.dimension()) {
      throw new IllegalArgumentException(
          "Query vector has "
              + vector.length
              + " dimensions, field "
              + field.name()
              + " expects "
              + field.dimension());
    }
    if (k < 1) {
      throw new IllegalArgumentException("k must be at least 1");
    }
  }
}
