package dev.videosearch.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the query embedding model, bound from {@code videosearch.embedding.*}.
 *
 * @param provider {@code remote} (HTTP embedding service) or {@code onnx} (in-process model)
 * @param baseUrl base URL of the embedding service
 * @param connectTimeoutMs TCP connection timeout
 * @param readTimeoutMs response read timeout
 * @param retry retry policy for transient HTTP failures
 */
@ConfigurationProperties(prefix = "videosearch.embedding")
public record EmbeddingProperties(
    String provider, String baseUrl, int connectTimeoutMs, int readTimeoutMs, Retry retry) {
  public record Retry(int maxAttempts, long delayMs, double multiplier) {}
}
