package dev.videosearch.store;

/**
 * Distance metric of a vector field. Fixed when the field is created; changing it requires a
 * rebuild of the collection.
 */
public enum DistanceMetric {
  /** Euclidean distance, scored {@code 1 / (1 + d^2)}. */
  L2("vector_l2_ops", "<->"),
  /** Cosine distance, scored {@code (1 + cos) / 2}. */
  COSINE("vector_cosine_ops", "<=>");

  private final String operatorClass;
  private final String operator;

  DistanceMetric(String operatorClass, String operator) {
    this.operatorClass = operatorClass;
    this.operator = operator;
  }

  /** pgvector operator class used by the HNSW index of a field with this metric. */
  public String operatorClass() {
    return operatorClass;
  }

  /** pgvector distance operator matching {@link #operatorClass()}. */
  public String operator() {
    return operator;
  }

  /**
   * SQL expression turning a distance expression into a similarity score where higher is better.
   *
   * @param distance SQL expression producing the raw distance
   * @return SQL expression for the score
   */
  String scoreExpression(String distance) {
    return switch (this) {
      case L2 -> "1.0 / (1.0 + power(" + distance + ", 2))";
      case COSINE -> "(2.0 - (" + distance + ")) / 2.0";
    };
  }
}
