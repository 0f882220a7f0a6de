package dev.videosearch.mcp;

import dev.videosearch.search.ClipResult;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Formats clip results as text blocks that fit a token budget.
 *
 * <p>Tokens are estimated at four characters each. Blocks are appended in rank order until the
 * next one would exceed the budget. A first block larger than the whole budget is cut at the
 * character level so that at least one result is returned.
 */
@Component
public class ClipResultFormatter {

  private static final double CHARS_PER_TOKEN = 4.0;

  private final int tokenBudget;

  public ClipResultFormatter(@Value("${videosearch.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats clips within the token budget.
   *
   * @param clips ranked clips
   * @return as many formatted clips as fit, or an empty string for no clips
   */
  public String format(@Nullable List<ClipResult> clips) {
    if (clips == null || clips.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;

    for (int i = 0; i < clips.size(); i++) {
      String formatted = formatClip(i + 1, clips.get(i));
      int clipTokens = estimateTokens(formatted);

      if (i == 0 && clipTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        break;
      }
      if (estimatedTokens + clipTokens > tokenBudget) {
        break;
      }
      output.append(formatted);
      estimatedTokens += clipTokens;
    }

    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String formatClip(int index, ClipResult clip) {
    StringBuilder block = new StringBuilder();
    block.append(
        "## [%d] Video %s, %.2fs - %.2fs\nClip: %s\nScore: %.3f\nVideo: %s\n"
            .formatted(
                index,
                clip.videoId(),
                clip.timestampStart(),
                clip.timestampEnd(),
                clip.clipId(),
                clip.score(),
                clip.videoPath()));
    if (clip.thumbnailUrl() != null) {
      block.append("Thumbnail: ").append(clip.thumbnailUrl()).append('\n');
    }
    if (clip.clipText() != null && !clip.clipText().isBlank()) {
      block.append('\n').append(clip.clipText()).append('\n');
    }
    return block.append("\n---\n").toString();
  }
}
