package dev.videosearch.embedding;

import static org.assertj.core.api.Assertions.assertThat;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Assume;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

/** Dimension and content invariants of {@link EmbeddingValidator} over generated vectors. */
class EmbeddingValidatorPropertyTest {

  @Property
  void wrongLengthIsAlwaysRejected(
      @ForAll("vectors") float[] vector, @ForAll @IntRange(min = 1, max = 64) int expected) {
    Assume.that(vector.length != expected);

    ValidationResult result = EmbeddingValidator.validate(vector, expected);

    assertThat(result.accepted()).isFalse();
    assertThat(result.reason()).contains("dimension mismatch");
  }

  @Property
  void zeroVectorOfCorrectLengthIsAlwaysRejected(@ForAll @IntRange(min = 1, max = 1024) int dim) {
    assertThat(EmbeddingValidator.validate(new float[dim], dim).accepted()).isFalse();
  }

  @Property
  void finiteVectorWithANonZeroElementIsAccepted(@ForAll("vectors") float[] vector) {
    Assume.that(hasNonZero(vector));

    ValidationResult result = EmbeddingValidator.validate(vector, vector.length);

    assertThat(result.accepted()).isTrue();
    assertThat(result.requireVector()).isSameAs(vector);
  }

  @Provide
  Arbitrary<float[]> vectors() {
    return Arbitraries.floats()
        .between(-10f, 10f)
        .array(float[].class)
        .ofMinSize(1)
        .ofMaxSize(64);
  }

  private static boolean hasNonZero(float[] vector) {
    for (float value : vector) {
      if (value != 0f) {
        return true;
      }
    }
    return false;
  }
}
