package dev.videosearch.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Outcome of a collection copy.
 *
 * @param source source collection
 * @param target target collection
 * @param tookSeconds wall-clock duration
 * @param attempted documents read from the source
 * @param created documents written to the target
 * @param errors documents whose write failed
 * @param skipped documents without any valid modality vector
 * @param skippedSample the first skipped documents, at most {@value CollectionCopyService#SKIPPED_SAMPLE_SIZE}
 * @param sourceCount documents in the source after the copy
 * @param targetCount documents in the target after the copy
 */
public record CopyReport(
        String source,
        String target,
        @JsonProperty("took_seconds") double tookSeconds,
        int attempted,
        int created,
        int errors,
        int skipped,
        @JsonProperty("skipped_sample") List<SkippedItem> skippedSample,
        @JsonProperty("source_count") long sourceCount,
        @JsonProperty("target_count") long targetCount) {
    public CopyReport {
        skippedSample = List.copyOf(skippedSample);
    }
}
