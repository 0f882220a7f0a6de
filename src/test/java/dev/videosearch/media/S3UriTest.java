package dev.videosearch.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class S3UriTest {

  @Test
  void parsesBucketAndKey() {
    S3Uri uri = S3Uri.parse("s3://videos/raw/2024/harbour.mp4");

    assertThat(uri.bucket()).isEqualTo("videos");
    assertThat(uri.key()).isEqualTo("raw/2024/harbour.mp4");
    assertThat(uri.fileName()).isEqualTo("harbour.mp4");
    assertThat(uri).hasToString("s3://videos/raw/2024/harbour.mp4");
  }

  @Test
  void bucketOnlyHasEmptyKey() {
    assertThat(S3Uri.parse("s3://videos").key()).isEmpty();
  }

  @ParameterizedTest
  @ValueSource(strings = {"https://videos.s3.amazonaws.com/a.mp4", "/data/a.mp4", "s3:///a.mp4", ""})
  void otherReferencesAreNotParsed(String reference) {
    assertThat(S3Uri.tryParse(reference)).isEmpty();
    assertThatThrownBy(() -> S3Uri.parse(reference))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Not an S3 URI");
  }

  @Test
  void nullIsNotParsed() {
    assertThat(S3Uri.tryParse(null)).isEmpty();
  }

  @Test
  void resolveAddsSeparatorOnce() {
    assertThat(S3Uri.parse("s3://out/jobs/42").resolve("output.json"))
        .hasToString("s3://out/jobs/42/output.json");
    assertThat(S3Uri.parse("s3://out/jobs/42/").resolve("output.json"))
        .hasToString("s3://out/jobs/42/output.json");
    assertThat(S3Uri.parse("s3://out").resolve("output.json")).hasToString("s3://out/output.json");
  }

  @Test
  void fileNameIgnoresTrailingSlash() {
    assertThat(S3Uri.parse("s3://out/jobs/42/").fileName()).isEqualTo("42");
  }
}
