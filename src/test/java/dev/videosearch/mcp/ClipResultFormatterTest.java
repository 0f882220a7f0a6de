package dev.videosearch.mcp;

import dev.videosearch.search.ClipResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClipResultFormatterTest {

    @Test
    void emptyOrNullGivesEmptyString() {
        ClipResultFormatter formatter = new ClipResultFormatter(5000);

        assertThat(formatter.format(null)).isEmpty();
        assertThat(formatter.format(List.of())).isEmpty();
    }

    @Test
    void blocksAreNumberedInRankOrder() {
        ClipResultFormatter formatter = new ClipResultFormatter(5000);

        String output = formatter.format(List.of(clip("clip_a", "first"), clip("clip_b", "second")));

        assertThat(output.indexOf("## [1]")).isLessThan(output.indexOf("## [2]"));
        assertThat(output.indexOf("Clip: clip_a")).isLessThan(output.indexOf("Clip: clip_b"));
        assertThat(output).endsWith("\n---\n");
    }

    @Test
    void stopsBeforeExceedingBudget() {
        ClipResultFormatter formatter = new ClipResultFormatter(100);
        List<ClipResult> clips = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            clips.add(clip("clip_" + i, "x".repeat(100)));
        }

        String output = formatter.format(clips);

        assertThat(formatter.estimateTokens(output)).isLessThanOrEqualTo(100);
        assertThat(output).contains("Clip: clip_0").doesNotContain("Clip: clip_9");
    }

    @Test
    void oversizedFirstBlockIsTruncated() {
        ClipResultFormatter formatter = new ClipResultFormatter(10);

        String output = formatter.format(List.of(clip("clip_a", "y".repeat(1000))));

        assertThat(output).hasSize(40).startsWith("## [1] Video video-1");
    }

    @Test
    void estimatesFourCharactersPerToken() {
        ClipResultFormatter formatter = new ClipResultFormatter(5000);

        assertThat(formatter.estimateTokens("")).isZero();
        assertThat(formatter.estimateTokens("abcd")).isEqualTo(1);
        assertThat(formatter.estimateTokens("abcde")).isEqualTo(2);
        assertThat(formatter.getTokenBudget()).isEqualTo(5000);
    }

    private static ClipResult clip(String clipId, String text) {
        return new ClipResult(clipId, "video-1", "https://cdn/v1.mp4", 0.0, 6.0, text, 0.5, null, null);
    }
}
