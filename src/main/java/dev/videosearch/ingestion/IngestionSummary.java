package dev.videosearch.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of an ingestion batch. Partial failure is reported here, never thrown.
 *
 * @param attempted records received
 * @param succeeded records whose document was written
 * @param failed records whose document write failed
 * @param skipped records rejected before writing (invalid embedding, unknown scope, bad time range,
 *     duplicate modality)
 * @param documentsWritten clip documents written; several records of one clip collapse into one
 */
public record IngestionSummary(
        int attempted,
        int succeeded,
        int failed,
        int skipped,
        @JsonProperty("documents_written") int documentsWritten) {

    public static IngestionSummary empty() {
        return new IngestionSummary(0, 0, 0, 0, 0);
    }
}
