package dev.videosearch.ingestion;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Collection copy settings, bound from {@code videosearch.copy.*}.
 *
 * @param batchSize documents read from the source per page
 * @param chunkSize documents per bulk write
 * @param maxAttempts attempts per bulk write while the store is rate limiting, first one included
 * @param initialBackoffMs first backoff delay
 * @param backoffMultiplier growth factor of the backoff delay
 * @param maxBackoffMs ceiling of one backoff delay
 */
@Validated
@ConfigurationProperties(prefix = "videosearch.copy")
public record CopyProperties(
        @Positive int batchSize,
        @Positive int chunkSize,
        @Min(1) int maxAttempts,
        @Positive long initialBackoffMs,
        @Positive double backoffMultiplier,
        @Positive long maxBackoffMs) {
}
