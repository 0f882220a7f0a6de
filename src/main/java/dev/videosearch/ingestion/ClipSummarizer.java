package dev.videosearch.ingestion;

import dev.langchain4j.model.chat.ChatModel;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Condenses a clip's text into a short summary with a chat model.
 *
 * <p>Only registered when summaries are enabled. A failed or empty model reply yields no summary
 * and leaves the clip text untouched.
 */
public class ClipSummarizer {

    private static final Logger log = LoggerFactory.getLogger(ClipSummarizer.class);

    static final String PROMPT = """
            Summarize the following video clip description in %d words or less.
            Be concise and capture the main content:

            %s

            Summary:""";

    private final ChatModel chatModel;
    private final SummaryProperties properties;

    public ClipSummarizer(ChatModel chatModel, SummaryProperties properties) {
        this.chatModel = chatModel;
        this.properties = properties;
    }

    /**
     * Summarises a clip text.
     *
     * @param text the clip text
     * @return the summary, or empty for blank input or when the model gives no usable reply
     */
    public Optional<String> summarize(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String input = text.length() > properties.maxInputChars()
                ? text.substring(0, properties.maxInputChars())
                : text;
        String reply;
        try {
            reply = chatModel.chat(PROMPT.formatted(properties.maxWords(), input));
        } catch (RuntimeException e) {
            log.error("Summary request failed for text of {} chars", text.length(), e);
            return Optional.empty();
        }
        if (reply == null || reply.isBlank()) {
            log.warn("Chat model returned an empty summary");
            return Optional.empty();
        }
        return Optional.of(reply.strip());
    }
}
