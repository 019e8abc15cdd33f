package com.scholary.transcriber.output;

import java.util.List;

/**
 * One speaker-attributed line of the transcript.
 *
 * @param speaker zero-based speaker index
 * @param start start time in seconds
 * @param end end time in seconds
 * @param text trimmed segment text, never empty
 * @param confidence mean word confidence, 0.0 when unknown
 * @param words timed words
 */
public record Utterance(
    int speaker,
    double start,
    double end,
    String text,
    double confidence,
    List<UtteranceWord> words) {

  public Utterance {
    words = words == null ? List.of() : List.copyOf(words);
  }
}
