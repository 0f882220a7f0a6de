package dev.videosearch.ingestion;

import static dev.videosearch.ingestion.ClipIndexerTest.vector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.videosearch.clip.ClipDocument;
import dev.videosearch.clip.Modality;
import dev.videosearch.fixture.InMemoryClipIndexStore;
import dev.videosearch.media.ObjectStore;
import dev.videosearch.media.ObjectStoreException;
import dev.videosearch.media.S3Uri;
import dev.videosearch.store.DistanceMetric;
import dev.videosearch.store.IndexSchema;
import dev.videosearch.store.IndexSchemaManager;
import dev.videosearch.store.UpstreamUnavailableException;
import dev.videosearch.store.VectorFieldSpec;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    private static final String COLLECTION = "video_clips";
    private static final int DIMENSION = 4;
    private static final S3Uri PAYLOAD = new S3Uri("embeddings", "jobs/42/output.json");

    private static ValidatorFactory validatorFactory;

    @Mock
    private ObjectStore objectStore;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemoryClipIndexStore store;
    private IngestionService service;

    @BeforeAll
    static void createValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryClipIndexStore();
        IndexSchema schema = new IndexSchema(COLLECTION, List.of(
                new VectorFieldSpec(Modality.VISUAL, "emb_visual", DIMENSION, DistanceMetric.COSINE),
                new VectorFieldSpec(Modality.AUDIO, "emb_audio", DIMENSION, DistanceMetric.COSINE)),
                "clip_text", "english");
        ClipIndexer indexer = new ClipIndexer(store, new IndexSchemaManager(store, schema));
        Validator validator = validatorFactory.getValidator();
        service = new IngestionService(indexer, objectStore, objectMapper, validator);
    }

    @Test
    void directIngestionUsesGivenVideoIdAndFileNameAsText() {
        ClipIngestionRequest request = new ClipIngestionRequest("s3://videos/raw/harbour.mp4", "video-1", 2, null,
                List.of(segment(0, 6, "visual-text", vector(DIMENSION)),
                        segment(0, 6, "audio", vector(DIMENSION))));

        IngestionResult result = service.ingest(request);

        assertThat(result.videoId()).isEqualTo("video-1");
        assertThat(result.part()).isEqualTo(2);
        assertThat(result.summary()).isEqualTo(new IngestionSummary(2, 2, 0, 0, 1));
        ClipDocument stored = store.documents(COLLECTION).get(0);
        assertThat(stored.clipText()).isEqualTo("harbour.mp4");
        assertThat(stored.part()).isEqualTo(2);
        verifyNoInteractions(objectStore);
    }

    @Test
    void missingVideoIdGetsRandomUuid() {
        ClipIngestionRequest request = new ClipIngestionRequest("https://cdn.example.com/v/harbour.mp4", null, 0,
                "boats", List.of(segment(0, 6, "visual-text", vector(DIMENSION))));

        IngestionResult result = service.ingest(request);

        assertThat(UUID.fromString(result.videoId())).isNotNull();
        assertThat(store.documents(COLLECTION).get(0).clipText()).isEqualTo("boats");
    }

    @Test
    void invalidEnvelopeIsRejected() {
        ClipIngestionRequest request = new ClipIngestionRequest(" ", null, -1, null, List.of());

        assertThatThrownBy(() -> service.ingest(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Validation failed: ")
                .hasMessageContaining("part")
                .hasMessageContaining("videoPath");
    }

    @Test
    void invalidSegmentIsSkippedNotThrown() {
        ClipIngestionRequest request = new ClipIngestionRequest("s3://videos/raw/harbour.mp4", "video-1", 0, null,
                List.of(segment(0, 6, "visual-text", vector(DIMENSION)),
                        segment(6, 12, "visual-text", vector(DIMENSION + 1))));

        IngestionResult result = service.ingest(request);

        assertThat(result.summary().succeeded()).isEqualTo(1);
        assertThat(result.summary().skipped()).isEqualTo(1);
    }

    @Test
    void objectStorePayloadIsReadFromOutputPrefix() throws Exception {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode data = root.putArray("data");
        data.add(objectMapper.valueToTree(segment(0, 6, "visual-text", vector(DIMENSION))));
        data.add(objectMapper.valueToTree(segment(6, 12, "visual-text", vector(DIMENSION))));
        when(objectStore.get(PAYLOAD)).thenReturn(objectMapper.writeValueAsBytes(root));

        IngestionResult result = service.ingestFromObjectStore(
                new ObjectStoreIngestionRequest("s3://embeddings/jobs/42", "s3://videos/raw/harbour.mp4", 1,
                        "video-9"));

        assertThat(result.videoId()).isEqualTo("video-9");
        assertThat(result.summary().documentsWritten()).isEqualTo(2);
    }

    @Test
    void unreadablePayloadIsUpstreamFailure() {
        when(objectStore.get(any(S3Uri.class)))
                .thenThrow(new ObjectStoreException("NoSuchKey", new RuntimeException()));

        assertThatThrownBy(() -> service.ingestFromObjectStore("s3://embeddings/jobs/42",
                "s3://videos/raw/harbour.mp4", 0, null))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("s3://embeddings/jobs/42/output.json");
    }

    @Test
    void malformedPayloadIsUpstreamFailure() {
        when(objectStore.get(PAYLOAD)).thenReturn("not json".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> service.ingestFromObjectStore("s3://embeddings/jobs/42",
                "s3://videos/raw/harbour.mp4", 0, null))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageStartingWith("Malformed embeddings output");
    }

    @Test
    void emptyPayloadIsUpstreamFailure() {
        when(objectStore.get(PAYLOAD)).thenReturn("{\"data\": []}".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> service.ingestFromObjectStore("s3://embeddings/jobs/42",
                "s3://videos/raw/harbour.mp4", 0, null))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageStartingWith("No embeddings data found");
    }

    @Test
    void outputUriMustBeS3() {
        assertThatThrownBy(() -> service.ingestFromObjectStore("https://example.com/out",
                "s3://videos/raw/harbour.mp4", 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fileNameOfPlainPath() {
        assertThat(IngestionService.fileName("/data/videos/dock.mp4")).isEqualTo("dock.mp4");
        assertThat(IngestionService.fileName("s3://videos/a/b/c.mov")).isEqualTo("c.mov");
    }

    private static EmbeddingSegment segment(double start, double end, String option, ArrayNode embedding) {
        return new EmbeddingSegment(start, end, option, embedding);
    }
}
