package dev.videosearch.ingestion;

import dev.videosearch.clip.ClipDocument;
import dev.videosearch.clip.Modality;
import dev.videosearch.embedding.EmbeddingValidator;
import dev.videosearch.store.BulkItemOutcome;
import dev.videosearch.store.ClipIndexStore;
import dev.videosearch.store.IndexSchema;
import dev.videosearch.store.IndexSchemaManager;
import dev.videosearch.store.RateLimitedException;
import dev.videosearch.store.VectorFieldSpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Copies the documents of one collection into another, e.g. to migrate to a new field layout or
 * to repopulate a restored collection.
 *
 * <p>Source documents are read page by page in clip id order. Each document's vectors are
 * re-validated against the target fields; documents left without any valid modality vector are
 * skipped. Page reads and bulk writes that the store rate limits are retried with capped, jittered
 * exponential backoff; once the attempt ceiling is reached the {@link RateLimitedException}
 * propagates and the copy stops.
 */
@Service
public class CollectionCopyService {

    static final int SKIPPED_SAMPLE_SIZE = 10;

    private static final Logger log = LoggerFactory.getLogger(CollectionCopyService.class);
    private static final Pattern COLLECTION_NAME = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    private final ClipIndexStore store;
    private final IndexSchemaManager schemaManager;
    private final CopyProperties properties;
    private final Clock clock;
    private final RetryTemplate retryTemplate;

    public CollectionCopyService(ClipIndexStore store,
                                 IndexSchemaManager schemaManager,
                                 CopyProperties properties,
                                 Clock clock) {
        this.store = store;
        this.schemaManager = schemaManager;
        this.properties = properties;
        this.clock = clock;
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(properties.maxAttempts())
                .exponentialBackoff(properties.initialBackoffMs(), properties.backoffMultiplier(),
                        properties.maxBackoffMs(), true)
                .retryOn(RateLimitedException.class)
                .withListener(new RateLimitLogger())
                .build();
    }

    /**
     * Copies every document of {@code source} with at least one valid vector into {@code target}.
     *
     * @param source existing collection to read
     * @param target collection to write; created with the configured field layout if absent
     * @return counts of the copy
     * @throws IllegalArgumentException if a name is invalid, both are equal, or the source is missing
     * @throws RateLimitedException if a read or bulk write is still rate limited after the last attempt
     */
    public CopyReport copy(String source, String target) {
        requireCollectionName("source", source);
        requireCollectionName("target", target);
        if (source.equals(target)) {
            throw new IllegalArgumentException("Source and target collections must differ");
        }
        if (!store.exists(source)) {
            throw new IllegalArgumentException("Source collection does not exist: " + source);
        }
        IndexSchema targetSchema = schemaManager.defaultSchema().forCollection(target);
        schemaManager.ensureSchema(targetSchema);

        Instant started = clock.instant();
        log.info("Copying collection {} into {}", source, target);

        int attempted = 0;
        int created = 0;
        int errors = 0;
        int skipped = 0;
        List<SkippedItem> skippedSample = new ArrayList<>();
        String afterClipId = null;

        while (true) {
            String after = afterClipId;
            List<ClipDocument> page = retryTemplate.execute(
                    context -> store.page(source, after, properties.batchSize()));
            if (page.isEmpty()) {
                break;
            }
            afterClipId = page.get(page.size() - 1).clipId();

            List<ClipDocument> valid = new ArrayList<>(page.size());
            for (ClipDocument document : page) {
                attempted++;
                ClipDocument revalidated = revalidate(document, targetSchema);
                if (revalidated.embeddings().isEmpty()) {
                    skipped++;
                    if (skippedSample.size() < SKIPPED_SAMPLE_SIZE) {
                        skippedSample.add(new SkippedItem(document.clipId(), document.videoId(),
                                "no valid modality vector"));
                    }
                } else {
                    valid.add(revalidated);
                }
            }

            for (int i = 0; i < valid.size(); i += properties.chunkSize()) {
                List<ClipDocument> chunk = valid.subList(i, Math.min(i + properties.chunkSize(), valid.size()));
                List<BulkItemOutcome> outcomes = retryTemplate.execute(
                        context -> store.bulkUpsert(target, chunk));
                for (BulkItemOutcome outcome : outcomes) {
                    if (outcome.created()) {
                        created++;
                    } else {
                        errors++;
                        log.warn("Failed to copy {}: {}", outcome.documentId(), outcome.error());
                    }
                }
            }
            log.info("Copy progress: {} read, {} created, {} errors, {} skipped",
                    attempted, created, errors, skipped);
        }

        double tookSeconds = Duration.between(started, clock.instant()).toMillis() / 1000.0;
        CopyReport report = new CopyReport(source, target, tookSeconds, attempted, created, errors, skipped,
                skippedSample, store.count(source), store.count(target));
        log.info("Copied {} into {} in {}s: {} created, {} errors, {} skipped",
                source, target, tookSeconds, created, errors, skipped);
        return report;
    }

    /** Keeps only the vectors that are valid for the target fields. */
    private static ClipDocument revalidate(ClipDocument document, IndexSchema targetSchema) {
        Map<Modality, float[]> kept = new EnumMap<>(Modality.class);
        for (VectorFieldSpec field : targetSchema.vectorFields()) {
            float[] vector = document.embedding(field.modality());
            if (vector != null && EmbeddingValidator.validate(vector, field.dimension()).accepted()) {
                kept.put(field.modality(), vector);
            }
        }
        return document.withEmbeddings(kept);
    }

    private static void requireCollectionName(String role, String name) {
        if (name == null || !COLLECTION_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid " + role + " collection name: " + name);
        }
    }

    /** Logs each rate-limited attempt before the backoff. */
    private static final class RateLimitLogger implements RetryListener {

        @Override
        public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                     Throwable throwable) {
            log.warn("Copy rate limited (attempt {}): {}", context.getRetryCount(), throwable.getMessage());
        }
    }
}
