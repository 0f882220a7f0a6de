package dev.videosearch.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.videosearch.ingestion.ClipSummarizer;
import dev.videosearch.ingestion.SummaryProperties;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the chat model behind generated clip summaries.
 *
 * <p>Nothing is registered unless {@code videosearch.summary.enabled} is true; thumbnail runs then
 * leave clip text as ingested.
 */
@Configuration
@ConditionalOnProperty(prefix = "videosearch.summary", name = "enabled", havingValue = "true")
public class SummaryConfig {

    @Bean
    public ChatModel summaryChatModel(SummaryProperties properties) {
        return OpenAiChatModel.builder()
                .baseUrl(properties.baseUrl())
                .apiKey(properties.apiKey())
                .modelName(properties.modelName())
                .temperature(properties.temperature())
                .maxTokens(properties.maxTokens())
                .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
                .build();
    }

    @Bean
    public ClipSummarizer clipSummarizer(ChatModel summaryChatModel, SummaryProperties properties) {
        return new ClipSummarizer(summaryChatModel, properties);
    }
}
