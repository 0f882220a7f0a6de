package dev.videosearch.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.videosearch.store.IndexSchema;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Wraps the black-box text embedding call behind a vector-or-unavailable contract.
 *
 * <p>Any failure of the underlying {@link EmbeddingModel} (exception, empty vector, or a vector
 * that would be rejected for the index's query dimension) is reported as {@link Optional#empty()}.
 * Callers decide whether unavailability is fatal for their path.
 */
@Service
public class EmbeddingGateway {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingGateway.class);

  private final EmbeddingModel embeddingModel;
  private final int queryDimension;

  public EmbeddingGateway(EmbeddingModel embeddingModel, IndexSchema indexSchema) {
    this.embeddingModel = embeddingModel;
    this.queryDimension = indexSchema.queryDimension();
  }

  /**
   * Embeds a query text.
   *
   * @param text the text to embed
   * @return the query vector, or empty when the embedding service is unavailable
   */
  public Optional<float[]> embedText(String text) {
    List<Embedding> embeddings;
    try {
      embeddings = embeddingModel.embedAll(List.of(TextSegment.from(text))).content();
    } catch (RuntimeException e) {
      log.error("Embedding request failed for query of {} chars", text.length(), e);
      return Optional.empty();
    }
    Embedding embedding = embeddings == null || embeddings.isEmpty() ? null : embeddings.get(0);
    if (embedding == null || embedding.vector().length == 0) {
      log.warn("Embedding service returned no vector");
      return Optional.empty();
    }
    ValidationResult result = EmbeddingValidator.validate(embedding.vector(), queryDimension);
    if (!result.accepted()) {
      log.warn("Discarding query embedding: {}", result.reason());
      return Optional.empty();
    }
    log.debug("Generated query embedding with {} dimensions", embedding.dimension());
    return Optional.of(result.requireVector());
  }
}
