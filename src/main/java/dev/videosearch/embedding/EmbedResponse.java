package dev.videosearch.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Response body of the embedding service: one entry per embedded input. */
@JsonIgnoreProperties(ignoreUnknown = true)
record EmbedResponse(@Nullable List<Item> data) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Item(float @Nullable [] embedding) {}

  /** First embedding in the response, or an empty array when there is none. */
  float[] firstEmbedding() {
    if (data == null || data.isEmpty() || data.get(0).embedding() == null) {
      return new float[0];
    }
    return data.get(0).embedding();
  }
}
