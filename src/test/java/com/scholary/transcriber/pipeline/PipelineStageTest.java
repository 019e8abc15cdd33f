package com.scholary.transcriber.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Locale;
import org.junit.jupiter.api.Test;

class PipelineStageTest {

  @Test
  void label_shouldNotDependOnDefaultLocale() {
    Locale original = Locale.getDefault();
    try {
      Locale.setDefault(new Locale("tr", "TR"));

      assertThat(PipelineStage.DIARIZE.label()).isEqualTo("diarize");
      assertThat(PipelineStage.TRANSCRIBE.label()).isEqualTo("transcribe");
      assertThat(PipelineStage.DURATION_PROBE.label()).isEqualTo("duration_probe");
    } finally {
      Locale.setDefault(original);
    }
  }
}
