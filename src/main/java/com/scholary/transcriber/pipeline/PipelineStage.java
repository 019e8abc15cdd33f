package com.scholary.transcriber.pipeline;

import java.util.Locale;

/** Pipeline stages in execution order. */
public enum PipelineStage {
  SETUP,
  DOWNLOAD,
  CONVERT,
  TRANSCRIBE,
  DIARIZE,
  FORMAT,
  DURATION_PROBE;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
