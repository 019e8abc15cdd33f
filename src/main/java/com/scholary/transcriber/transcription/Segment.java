package com.scholary.transcriber.transcription;

import java.util.List;

/**
 * A contiguous unit of recognized speech, before speaker attribution.
 *
 * <p>Times are in seconds from the start of the audio.
 */
public record Segment(double start, double end, String text, List<Word> words) {

  public Segment {
    if (end < start) {
      throw new IllegalArgumentException(
          String.format("Invalid segment: end time must be >= start time (%s < %s)", end, start));
    }
    text = text == null ? "" : text;
    words = words == null ? List.of() : List.copyOf(words);
  }
}
