package com.scholary.transcriber.transcription;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class ModelSizesTest {

  @ParameterizedTest
  @CsvSource({
    "tiny, tiny",
    "base, base",
    "small, small",
    "medium, medium",
    "large, large",
    "large-v1, large",
    "large-v2, large",
    "large-v3, large",
    "v2, large",
    "v3, large",
    "turbo, large",
    "large-v3-turbo, large",
    "medium.en, medium",
    "tiny.en, tiny",
    "LARGE-V3, large"
  })
  void resolve_shouldMapAliasesToSupportedSizes(String requested, String expected) {
    assertThat(ModelSizes.resolve(requested, "medium")).isEqualTo(expected);
    assertThat(ModelSizes.isKnown(requested)).isTrue();
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"  "})
  void resolve_shouldUseDefaultForBlank(String requested) {
    assertThat(ModelSizes.resolve(requested, "small")).isEqualTo("small");
  }

  @ParameterizedTest
  @ValueSource(strings = {"huge", "large-v9", "xl.en"})
  void resolve_shouldUseDefaultForUnknownSizes(String requested) {
    assertThat(ModelSizes.resolve(requested, "medium")).isEqualTo("medium");
    assertThat(ModelSizes.isKnown(requested)).isFalse();
  }
}
