package dev.videosearch.clip;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ClipIdGeneratorTest {

  @Test
  void idHasPrefixAndSixteenHexCharacters() {
    String id = ClipIdGenerator.clipId("video-1", 1.23, 4.56);

    assertThat(id).startsWith("clip_").hasSize(21);
    assertThat(id.substring(5)).matches("[0-9a-f]{16}");
  }

  @Test
  void sameVideoAndRangeGiveSameId() {
    assertThat(ClipIdGenerator.clipId("video-1", 1.23, 4.56))
        .isEqualTo(ClipIdGenerator.clipId("video-1", 1.23, 4.56));
  }

  @Test
  void timestampsAreComparedAtTwoDecimals() {
    assertThat(ClipIdGenerator.clipId("video-1", 1.2301, 4.5599))
        .isEqualTo(ClipIdGenerator.clipId("video-1", 1.23, 4.56));
  }

  @Test
  void differentVideoOrRangeGiveDifferentIds() {
    String base = ClipIdGenerator.clipId("video-1", 0.0, 6.0);

    assertThat(ClipIdGenerator.clipId("video-2", 0.0, 6.0)).isNotEqualTo(base);
    assertThat(ClipIdGenerator.clipId("video-1", 6.0, 12.0)).isNotEqualTo(base);
  }

  @Test
  void nonFiniteTimestampIsRejected() {
    assertThatThrownBy(() -> ClipIdGenerator.clipId("video-1", Double.NaN, 1.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("finite");
  }

  @Test
  void roundForIdentityKeepsTwoDecimals() {
    assertThat(ClipIdGenerator.roundForIdentity(12.3456)).isEqualTo(12.35);
    assertThat(ClipIdGenerator.roundForIdentity(7.0)).isEqualTo(7.0);
  }
}
