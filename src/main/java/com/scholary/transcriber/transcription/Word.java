package com.scholary.transcriber.transcription;

import java.util.OptionalDouble;

/**
 * A recognized word.
 *
 * <p>The recognizer does not always time every word, so timing and probability are optional. A
 * word is only usable for output when it has both a start and an end.
 */
public record Word(
    String text, OptionalDouble start, OptionalDouble end, OptionalDouble probability) {

  public Word {
    text = text == null ? "" : text;
    start = start == null ? OptionalDouble.empty() : start;
    end = end == null ? OptionalDouble.empty() : end;
    probability = probability == null ? OptionalDouble.empty() : probability;
  }

  public static Word of(String text, Double start, Double end, Double probability) {
    return new Word(text, optional(start), optional(end), optional(probability));
  }

  public boolean isTimed() {
    return start.isPresent() && end.isPresent();
  }

  private static OptionalDouble optional(Double value) {
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }
}
