package dev.videosearch.ingestion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Embedding model output file ({@code output.json}): {@code {"data": [segment, ...]}}.
 *
 * @param data the segments, in model output order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingPayload(List<EmbeddingSegment> data) {
    public EmbeddingPayload {
        data = data == null ? List.of() : List.copyOf(data);
    }
}
