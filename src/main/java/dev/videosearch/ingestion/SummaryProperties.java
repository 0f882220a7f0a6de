package dev.videosearch.ingestion;

import jakarta.validation.constraints.Positive;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Clip summary settings, bound from {@code videosearch.summary.*}.
 *
 * @param enabled whether thumbnail runs also replace clip text with a generated summary
 * @param baseUrl base URL of the OpenAI-compatible chat endpoint
 * @param apiKey key for the chat endpoint
 * @param modelName chat model to use
 * @param maxWords upper bound on summary length asked from the model
 * @param maxInputChars clip text beyond this length is cut before summarising
 * @param temperature sampling temperature
 * @param maxTokens ceiling on generated tokens
 * @param timeoutSeconds ceiling for one chat call
 */
@Validated
@ConfigurationProperties(prefix = "videosearch.summary")
public record SummaryProperties(
        boolean enabled,
        @Nullable String baseUrl,
        @Nullable String apiKey,
        @Nullable String modelName,
        @Positive int maxWords,
        @Positive int maxInputChars,
        double temperature,
        @Positive int maxTokens,
        @Positive int timeoutSeconds) {
}
