package dev.videosearch.store;

import dev.videosearch.clip.Modality;
import java.util.List;
import java.util.Optional;

/**
 * Schema of a clip collection: its name, one vector field per modality, and the keyword field.
 *
 * @param collection collection (table) name
 * @param vectorFields vector fields in declaration order
 * @param keywordField field holding the clip text for keyword matching
 * @param textSearchConfig full-text search configuration used for the keyword field
 */
public record IndexSchema(
    String collection,
    List<VectorFieldSpec> vectorFields,
    String keywordField,
    String textSearchConfig) {

  public IndexSchema {
    vectorFields = List.copyOf(vectorFields);
    if (vectorFields.isEmpty()) {
      throw new IllegalArgumentException("Index schema needs at least one vector field");
    }
  }

  /** Returns the vector field for a modality, if the collection declares one. */
  public Optional<VectorFieldSpec> findField(Modality modality) {
    return vectorFields.stream().filter(f -> f.modality() == modality).findFirst();
  }

  /** Returns the vector field for a modality or throws when it is not declared. */
  public VectorFieldSpec field(Modality modality) {
    return findField(modality)
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Collection " + collection + " has no " + modality.key() + " field"));
  }

  /**
   * Dimension expected from the query embedding model. All fields are searched with the same
   * query vector, so they share one dimension.
   */
  public int queryDimension() {
    return vectorFields.get(0).dimension();
  }

  /** Returns the same field layout under another collection name. */
  public IndexSchema forCollection(String name) {
    return new IndexSchema(name, vectorFields, keywordField, textSearchConfig);
  }
}
