package dev.videosearch.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ClipSummarizerTest {

    @Mock
    private ChatModel chatModel;

    private ClipSummarizer summarizer;

    @BeforeEach
    void setUp() {
        SummaryProperties properties = new SummaryProperties(true, "http://localhost:4000/v1", "test",
                "summary-model", 40, 20, 0.7, 256, 30);
        summarizer = new ClipSummarizer(chatModel, properties);
    }

    @Test
    void promptCarriesWordLimitAndTruncatedText() {
        when(chatModel.chat(any(String.class))).thenReturn("A fishing boat docks.");

        assertThat(summarizer.summarize("A fishing boat docks in the harbour at dawn"))
                .contains("A fishing boat docks.");

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(chatModel).chat(prompt.capture());
        assertThat(prompt.getValue())
                .contains("in 40 words or less")
                .contains("A fishing boat docks")
                .doesNotContain("harbour")
                .endsWith("Summary:");
    }

    @Test
    void blankTextIsNotSentToTheModel() {
        assertThat(summarizer.summarize("   ")).isEmpty();
        assertThat(summarizer.summarize(null)).isEmpty();

        verifyNoInteractions(chatModel);
    }

    @Test
    void emptyReplyYieldsNoSummary() {
        when(chatModel.chat(any(String.class))).thenReturn(" ");

        assertThat(summarizer.summarize("Gulls over the pier")).isEmpty();
    }

    @Test
    void modelFailureYieldsNoSummary() {
        when(chatModel.chat(any(String.class))).thenThrow(new IllegalStateException("timeout"));

        assertThat(summarizer.summarize("Gulls over the pier")).isEmpty();
    }
}
