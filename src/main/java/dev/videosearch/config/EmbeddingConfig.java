package dev.videosearch.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.videosearch.embedding.EmbeddingProperties;
import dev.videosearch.embedding.RemoteEmbeddingModel;
import dev.videosearch.store.IndexSchema;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the query embedding model.
 *
 * <p>Query vectors have to live in the same space as the indexed video embeddings, so the default
 * provider is the remote multi-modal embedding service. The in-process ONNX model
 * (bge-small-en-v1.5 quantized, 384 dimensions) is only meant for local development against a
 * 384-dimension index.
 *
 * @see dev.videosearch.embedding.EmbeddingGateway
 */
@Configuration
public class EmbeddingConfig {

    /**
     * Creates a pre-configured {@link RestClient} targeting the embedding service.
     *
     * @param builder    Spring-provided builder with common defaults
     * @param properties embedding settings (base URL and timeouts)
     * @return a named REST client bean for injection into {@link RemoteEmbeddingModel}
     */
    @Bean
    @ConditionalOnProperty(prefix = "videosearch.embedding", name = "provider", havingValue = "remote",
            matchIfMissing = true)
    public RestClient embeddingRestClient(RestClient.Builder builder, EmbeddingProperties properties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

        return builder
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * Provides the remote embedding model, producing vectors of the index's query dimension.
     *
     * @param restClient  client bound to the embedding service
     * @param indexSchema resolved index schema, source of the expected dimension
     * @return an embedding model that calls the external service
     */
    @Bean
    @ConditionalOnProperty(prefix = "videosearch.embedding", name = "provider", havingValue = "remote",
            matchIfMissing = true)
    public EmbeddingModel remoteEmbeddingModel(
            @Qualifier("embeddingRestClient") RestClient restClient, IndexSchema indexSchema) {
        return new RemoteEmbeddingModel(restClient, indexSchema.queryDimension());
    }

    /**
     * Provides the in-process ONNX embedding model for local development.
     *
     * @return a ready-to-use embedding model requiring no external API
     */
    @Bean
    @ConditionalOnProperty(prefix = "videosearch.embedding", name = "provider", havingValue = "onnx")
    public EmbeddingModel onnxEmbeddingModel() {
        return new BgeSmallEnV15QuantizedEmbeddingModel();
    }
}
