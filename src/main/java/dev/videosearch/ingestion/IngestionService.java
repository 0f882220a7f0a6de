package dev.videosearch.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.videosearch.clip.ClipRecord;
import dev.videosearch.media.ObjectStore;
import dev.videosearch.media.ObjectStoreException;
import dev.videosearch.media.S3Uri;
import dev.videosearch.store.UpstreamUnavailableException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns embedding model output into clip records and hands them to the {@link ClipIndexer}.
 *
 * <p>Segments are mapped one to one onto records: the video id is the given one or a fresh random
 * UUID, the clip text defaults to the video file name and the embedding scope comes from the
 * segment's embedding option. Embedding validation is left to the indexer so that one bad segment
 * only skips itself.
 */
@Service
public class IngestionService {

    static final String OUTPUT_FILE = "output.json";

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final ClipIndexer clipIndexer;
    private final ObjectStore objectStore;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    public IngestionService(ClipIndexer clipIndexer,
                            ObjectStore objectStore,
                            ObjectMapper objectMapper,
                            Validator validator) {
        this.clipIndexer = clipIndexer;
        this.objectStore = objectStore;
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    /**
     * Ingests segments posted directly.
     *
     * @param request the segments and their video
     * @return the video id used and the per-record counts
     * @throws IllegalArgumentException if the request envelope is invalid
     */
    public IngestionResult ingest(ClipIngestionRequest request) {
        requireValid(request);
        return index(request.segments(), request.videoPath(), request.part(),
                request.videoId(), request.clipText());
    }

    /**
     * Ingests the {@code output.json} stored under an object store prefix.
     *
     * @param outputUri {@code s3://} prefix of the embedding job output
     * @param videoPath storage URI of the source video
     * @param part ingestion batch number
     * @param videoId video id to index under, or null for a fresh one
     * @return the video id used and the per-record counts
     * @throws IllegalArgumentException if {@code outputUri} is not an S3 URI
     * @throws UpstreamUnavailableException if the payload cannot be read or parsed
     */
    public IngestionResult ingestFromObjectStore(String outputUri, String videoPath, int part,
                                                 @Nullable String videoId) {
        S3Uri payloadUri = S3Uri.parse(outputUri).resolve(OUTPUT_FILE);
        log.info("Reading embeddings for part {} from {}", part, payloadUri);
        EmbeddingPayload payload;
        try {
            payload = objectMapper.readValue(objectStore.get(payloadUri), EmbeddingPayload.class);
        } catch (ObjectStoreException e) {
            throw new UpstreamUnavailableException("Could not read embeddings output at " + payloadUri, e);
        } catch (IOException e) {
            throw new UpstreamUnavailableException("Malformed embeddings output at " + payloadUri, e);
        }
        if (payload.data().isEmpty()) {
            throw new UpstreamUnavailableException("No embeddings data found at " + payloadUri);
        }
        return index(payload.data(), videoPath, part, videoId, null);
    }

    /**
     * Validates the request envelope, then ingests its payload.
     *
     * @throws IllegalArgumentException if the request envelope is invalid
     */
    public IngestionResult ingestFromObjectStore(ObjectStoreIngestionRequest request) {
        requireValid(request);
        return ingestFromObjectStore(request.outputUri(), request.videoPath(), request.part(), request.videoId());
    }

    private <T> void requireValid(T request) {
        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String messages = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Validation failed: " + messages);
        }
    }

    private IngestionResult index(List<EmbeddingSegment> segments, String videoPath, int part,
                                  @Nullable String videoId, @Nullable String clipText) {
        String resolvedVideoId = videoId == null || videoId.isBlank() ? UUID.randomUUID().toString() : videoId;
        String resolvedText = clipText == null || clipText.isBlank() ? fileName(videoPath) : clipText;
        log.info("Processing {} segments for part {} of video {}", segments.size(), part, resolvedVideoId);

        List<ClipRecord> records = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            EmbeddingSegment segment = segments.get(i);
            records.add(new ClipRecord(
                    resolvedVideoId,
                    videoPath,
                    part,
                    i,
                    segment.startSec(),
                    segment.endSec(),
                    segment.embeddingOption(),
                    segment.embedding(),
                    resolvedText,
                    null));
        }
        IngestionSummary summary = clipIndexer.upsert(records);
        return new IngestionResult(resolvedVideoId, part, summary);
    }

    /** Last path segment of a storage reference. */
    static String fileName(String videoPath) {
        return S3Uri.tryParse(videoPath)
                .map(S3Uri::fileName)
                .orElseGet(() -> videoPath.substring(videoPath.lastIndexOf('/') + 1));
    }
}
