package com.scholary.transcriber.output;

import com.scholary.transcriber.diarization.DiarizedSegment;
import com.scholary.transcriber.output.TranscriptJson.SpeakerSummary;
import com.scholary.transcriber.transcription.Segment;
import com.scholary.transcriber.transcription.Word;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Turns diarized segments into the transcript text, the transcript JSON and the utterance list.
 *
 * <p>The text form is one {@code "Speaker {index}: {text}"} line per utterance. The recording
 * application splits it on newlines and parses {@code "Name: text"}, so the format must not
 * change.
 */
@Component
public class OutputFormatter {

  public FormattedTranscript format(List<DiarizedSegment> segments) {
    List<Utterance> utterances = new ArrayList<>();
    for (DiarizedSegment diarized : segments) {
      Segment segment = diarized.segment();
      // one line per utterance in transcript_text
      String text = segment.text().replaceAll("[\\r\\n]+", " ").trim();
      if (text.isEmpty()) {
        continue;
      }
      List<UtteranceWord> words = timedWords(segment.words());
      utterances.add(
          new Utterance(
              speakerIndex(diarized.speaker()),
              round(segment.start(), 3),
              round(segment.end(), 3),
              text,
              round(meanConfidence(segment.words()), 4),
              words));
    }

    StringBuilder transcriptText = new StringBuilder();
    Map<Integer, Integer> countsBySpeaker = new TreeMap<>();
    for (Utterance utterance : utterances) {
      if (transcriptText.length() > 0) {
        transcriptText.append('\n');
      }
      transcriptText.append("Speaker ").append(utterance.speaker()).append(": ").append(utterance.text());
      countsBySpeaker.merge(utterance.speaker(), 1, Integer::sum);
    }

    List<SpeakerSummary> speakers = new ArrayList<>();
    countsBySpeaker.forEach((id, count) -> speakers.add(new SpeakerSummary(id, count)));

    String text = transcriptText.toString();
    List<Utterance> frozen = List.copyOf(utterances);
    return new FormattedTranscript(
        text,
        new TranscriptJson(frozen, List.copyOf(speakers)),
        frozen,
        Math.max(1, countsBySpeaker.size()),
        countWords(text));
  }

  /**
   * Parse a diarization label such as {@code SPEAKER_01} into its index.
   *
   * @return the number after the last underscore, or 0 when the label is missing or malformed
   */
  static int speakerIndex(String label) {
    if (label == null || label.isBlank()) {
      return 0;
    }
    String digits = label.substring(label.lastIndexOf('_') + 1).trim();
    try {
      int index = Integer.parseInt(digits);
      return index >= 0 ? index : 0;
    } catch (NumberFormatException e) {
      return 0;
    }
  }

  static int countWords(String text) {
    String trimmed = text.trim();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }

  static double round(double value, int decimals) {
    double scale = Math.pow(10, decimals);
    return Math.round(value * scale) / scale;
  }

  private static List<UtteranceWord> timedWords(List<Word> words) {
    List<UtteranceWord> timed = new ArrayList<>();
    for (Word word : words) {
      if (!word.isTimed()) {
        continue;
      }
      timed.add(
          new UtteranceWord(
              word.text().trim(),
              round(word.start().getAsDouble(), 3),
              round(word.end().getAsDouble(), 3),
              round(word.probability().orElse(0.0), 4)));
    }
    return timed;
  }

  private static double meanConfidence(List<Word> words) {
    OptionalDouble mean =
        words.stream()
            .map(Word::probability)
            .filter(OptionalDouble::isPresent)
            .mapToDouble(OptionalDouble::getAsDouble)
            .average();
    return mean.orElse(0.0);
  }
}
