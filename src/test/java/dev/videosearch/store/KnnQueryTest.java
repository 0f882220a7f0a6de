package dev.videosearch.store;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.videosearch.clip.Modality;
import org.junit.jupiter.api.Test;

class KnnQueryTest {

  private final VectorFieldSpec field =
      new VectorFieldSpec(Modality.AUDIO, "emb_audio", 3, DistanceMetric.L2);

  @Test
  void vectorMustMatchFieldDimension() {
    assertThatThrownBy(() -> new KnnQuery(field, new float[] {1f, 2f}, 10, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("emb_audio expects 3");
  }

  @Test
  void kMustBePositive() {
    assertThatThrownBy(() -> new KnnQuery(field, new float[] {1f, 2f, 3f}, 0, null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
