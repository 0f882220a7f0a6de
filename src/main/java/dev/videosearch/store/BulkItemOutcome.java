package dev.videosearch.store;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of one document in a bulk write.
 *
 * @param documentId clip id
 * @param created whether the document was written
 * @param error failure reason when it was not
 */
public record BulkItemOutcome(String documentId, boolean created, @Nullable String error) {

  public static BulkItemOutcome created(String documentId) {
    return new BulkItemOutcome(documentId, true, null);
  }

  public static BulkItemOutcome failed(String documentId, String error) {
    return new BulkItemOutcome(documentId, false, error);
  }
}
