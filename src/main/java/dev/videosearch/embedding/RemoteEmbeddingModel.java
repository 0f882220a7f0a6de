package dev.videosearch.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * LangChain4j {@link EmbeddingModel} backed by the external multi-modal embedding service.
 *
 * <p>Query vectors must come from the same model that produced the indexed video embeddings, so
 * text is sent to that service's {@code /embed} endpoint rather than embedded in-process. Transient
 * {@link RestClientException}s are retried with exponential backoff; an empty response yields an
 * empty vector, which the {@link EmbeddingGateway} reports as unavailable.
 */
public class RemoteEmbeddingModel implements EmbeddingModel {

  private static final Logger log = LoggerFactory.getLogger(RemoteEmbeddingModel.class);

  private final RestClient restClient;
  private final int dimension;

  public RemoteEmbeddingModel(RestClient restClient, int dimension) {
    this.restClient = restClient;
    this.dimension = dimension;
  }

  @Override
  @Retryable(
      retryFor = RestClientException.class,
      maxAttemptsExpression = "${videosearch.embedding.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${videosearch.embedding.retry.delay-ms}",
              multiplierExpression = "${videosearch.embedding.retry.multiplier}"))
  public Response<List<Embedding>> embedAll(List<TextSegment> textSegments) {
    List<Embedding> embeddings = new ArrayList<>(textSegments.size());
    for (TextSegment segment : textSegments) {
      EmbedResponse response =
          restClient.post().uri("/embed").body(EmbedRequest.text(segment.text())).retrieve()
              .body(EmbedResponse.class);
      float[] vector = response == null ? new float[0] : response.firstEmbedding();
      if (vector.length == 0) {
        log.warn("Embedding service returned no data for input of {} chars", segment.text().length());
      }
      embeddings.add(Embedding.from(vector));
    }
    return Response.from(embeddings);
  }

  @Override
  public int dimension() {
    return dimension;
  }
}
