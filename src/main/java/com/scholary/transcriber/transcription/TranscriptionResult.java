package com.scholary.transcriber.transcription;

import java.util.List;

/** Ordered segments plus the language the recognizer settled on. */
public record TranscriptionResult(List<Segment> segments, String language) {

  public TranscriptionResult {
    segments = List.copyOf(segments);
  }
}
