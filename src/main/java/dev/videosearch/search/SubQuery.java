package dev.videosearch.search;

import dev.videosearch.store.KnnQuery;
import dev.videosearch.store.MatchQuery;
import dev.videosearch.store.VectorFieldSpec;
import org.jspecify.annotations.Nullable;

/**
 * One query sent to the store as part of a search.
 *
 * @param kind k-NN on a vector field or keyword match
 * @param label stable label used in diagnostics, e.g. {@code knn:visual}
 * @param field the vector field (k-NN only)
 * @param vector the query vector (k-NN only)
 * @param text the query text (match only)
 * @param size candidate count
 * @param minScore score floor applied by the store (k-NN only)
 * @param weight weight under weighted fusion policies
 */
public record SubQuery(
    Kind kind,
    String label,
    @Nullable VectorFieldSpec field,
    float @Nullable [] vector,
    @Nullable String text,
    int size,
    @Nullable Double minScore,
    double weight) {

  public enum Kind {
    KNN,
    MATCH
  }

  public static SubQuery knn(
      VectorFieldSpec field, float[] vector, int size, @Nullable Double minScore, double weight) {
    return new SubQuery(
        Kind.KNN, "knn:" + field.modality().key(), field, vector, null, size, minScore, weight);
  }

  public static SubQuery match(String text, int size, double weight) {
    return new SubQuery(Kind.MATCH, "match", null, null, text, size, null, weight);
  }

  /** The store query of a k-NN sub-query. */
  public KnnQuery toKnnQuery() {
    if (kind != Kind.KNN || field == null || vector == null) {
      throw new IllegalStateException(label + " is not a k-NN sub-query");
    }
    return new KnnQuery(field, vector, size, minScore);
  }

  /** The store query of a match sub-query. */
  public MatchQuery toMatchQuery() {
    if (kind != Kind.MATCH || text == null) {
      throw new IllegalStateException(label + " is not a match sub-query");
    }
    return new MatchQuery(text, size);
  }
}
