package dev.videosearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the video clip search service.
 *
 * <p>Serves hybrid clip search over REST and MCP, and exposes the ingestion endpoints that feed
 * embedding payloads into the clip index.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class VideoSearchApplication {
    public static void main(String[] args) {
        SpringApplication.run(VideoSearchApplication.class, args);
    }
}
