package dev.videosearch.ingestion;

import dev.videosearch.clip.ClipDocument;
import dev.videosearch.clip.ClipRecord;
import dev.videosearch.clip.Modality;
import dev.videosearch.embedding.EmbeddingValidator;
import dev.videosearch.embedding.ValidationResult;
import dev.videosearch.store.ClipIndexStore;
import dev.videosearch.store.IndexSchema;
import dev.videosearch.store.IndexSchemaManager;
import dev.videosearch.store.VectorFieldSpec;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes validated clip records to the index store.
 *
 * <p>Every record is validated against the dimension of the field its scope maps to. Records of the
 * same clip (same video and rounded time range) collapse into one document carrying one vector per
 * modality; when a batch holds two vectors for the same clip and modality the first one wins.
 * Each document is written on its own: a rejected record or a failed write is counted and logged,
 * and the rest of the batch continues.
 */
@Service
public class ClipIndexer {

    private static final Logger log = LoggerFactory.getLogger(ClipIndexer.class);

    private final ClipIndexStore store;
    private final IndexSchemaManager schemaManager;

    public ClipIndexer(ClipIndexStore store, IndexSchemaManager schemaManager) {
        this.store = store;
        this.schemaManager = schemaManager;
    }

    /**
     * Validates and upserts a batch of clip records.
     *
     * @param records incoming modality records
     * @return per-record counts of the batch
     */
    public IngestionSummary upsert(List<ClipRecord> records) {
        schemaManager.ensureSchema();
        IndexSchema schema = schemaManager.defaultSchema();

        Map<String, ClipDocument> documents = new LinkedHashMap<>();
        Map<String, Integer> recordCounts = new LinkedHashMap<>();
        int skipped = 0;

        for (ClipRecord record : records) {
            Optional<String> rejection = admit(record, schema, documents, recordCounts);
            if (rejection.isPresent()) {
                skipped++;
                log.warn("Skipping segment {} of video {}: {}",
                        record.segmentIndex(), record.videoId(), rejection.get());
            }
        }

        int succeeded = 0;
        int failed = 0;
        int written = 0;
        for (ClipDocument document : documents.values()) {
            int count = recordCounts.get(document.clipId());
            try {
                store.upsert(schema.collection(), document);
                succeeded += count;
                written++;
            } catch (RuntimeException e) {
                failed += count;
                log.error("Failed to write clip {} of video {}", document.clipId(), document.videoId(), e);
            }
        }

        IngestionSummary summary = new IngestionSummary(records.size(), succeeded, failed, skipped, written);
        log.info("Indexed batch: {} attempted, {} succeeded, {} failed, {} skipped, {} documents written",
                summary.attempted(), summary.succeeded(), summary.failed(), summary.skipped(),
                summary.documentsWritten());
        return summary;
    }

    /**
     * Validates one record and merges it into the pending documents.
     *
     * @return the rejection reason, or empty when the record was admitted
     */
    private Optional<String> admit(ClipRecord record, IndexSchema schema,
                                   Map<String, ClipDocument> documents, Map<String, Integer> recordCounts) {
        if (!Double.isFinite(record.timestampStart()) || !Double.isFinite(record.timestampEnd())) {
            return Optional.of("non-finite timestamps");
        }
        if (record.timestampEnd() < record.timestampStart()) {
            return Optional.of("end " + record.timestampEnd() + " before start " + record.timestampStart());
        }
        Optional<Modality> modality = Modality.fromScope(record.embeddingScope());
        if (modality.isEmpty()) {
            return Optional.of("unknown embedding scope '" + record.embeddingScope() + "'");
        }
        Optional<VectorFieldSpec> field = schema.findField(modality.get());
        if (field.isEmpty()) {
            return Optional.of("no vector field for " + modality.get().key());
        }
        ValidationResult result = EmbeddingValidator.validate(record.embedding(), field.get().dimension());
        if (!result.accepted()) {
            return Optional.of(String.valueOf(result.reason()));
        }

        String clipId = record.clipId();
        ClipDocument existing = documents.get(clipId);
        if (existing == null) {
            documents.put(clipId, new ClipDocument(
                    clipId,
                    record.videoId(),
                    record.videoPath(),
                    record.part(),
                    record.segmentIndex(),
                    record.timestampStart(),
                    record.timestampEnd(),
                    record.embeddingScope(),
                    record.clipText(),
                    record.thumbnailUri(),
                    Map.of(modality.get(), result.requireVector())));
        } else if (existing.embedding(modality.get()) != null) {
            return Optional.of("duplicate " + modality.get().key() + " embedding for " + clipId);
        } else {
            documents.put(clipId, existing.withEmbedding(modality.get(), result.requireVector(),
                    record.embeddingScope()));
        }
        recordCounts.merge(clipId, 1, Integer::sum);
        return Optional.empty();
    }

    /**
     * Deletes every clip of a video.
     *
     * @param videoId the video to remove
     * @return number of clip documents deleted
     */
    public int deleteVideo(String videoId) {
        schemaManager.ensureSchema();
        int deleted = store.deleteByVideoId(schemaManager.defaultSchema().collection(), videoId);
        log.info("Deleted {} clips of video {}", deleted, videoId);
        return deleted;
    }

    /**
     * Replaces the keyword text of a clip, e.g. with a generated summary.
     *
     * @return false when the clip does not exist
     */
    public boolean replaceClipText(String clipId, String clipText) {
        if (clipText == null || clipText.isBlank()) {
            throw new IllegalArgumentException("clip_text must not be blank");
        }
        schemaManager.ensureSchema();
        return store.updateClipText(schemaManager.defaultSchema().collection(), clipId, clipText);
    }

    /**
     * Attaches a thumbnail reference to a clip.
     *
     * @return false when the clip does not exist
     */
    public boolean attachThumbnail(String clipId, String thumbnailUri) {
        schemaManager.ensureSchema();
        return store.updateThumbnail(schemaManager.defaultSchema().collection(), clipId, thumbnailUri);
    }

    /** Clips of a video ordered by start time. */
    public List<ClipDocument> clipsOf(String videoId) {
        schemaManager.ensureSchema();
        return store.findByVideoId(schemaManager.defaultSchema().collection(), videoId);
    }
}
