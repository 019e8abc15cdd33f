package com.scholary.transcriber.diarization;

import com.scholary.transcriber.transcription.Segment;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Attributes transcript segments to speakers by time overlap.
 *
 * <p>For each segment the overlap with every turn is summed per speaker:
 *
 * <pre>
 * overlap = max(0, min(segEnd, turnEnd) - max(segStart, turnStart))
 * </pre>
 *
 * The speaker with the largest total wins. Equal totals go to the lexicographically smallest
 * label. A segment no turn overlaps gets {@link #DEFAULT_SPEAKER}.
 */
public final class SpeakerAssigner {

  public static final String DEFAULT_SPEAKER = "SPEAKER_00";

  private SpeakerAssigner() {}

  public static List<DiarizedSegment> assign(
      List<Segment> segments, List<DiarizationTurn> turns) {
    List<DiarizedSegment> result = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      result.add(new DiarizedSegment(segment, speakerFor(segment, turns)));
    }
    return result;
  }

  public static List<DiarizedSegment> assignDefault(List<Segment> segments) {
    List<DiarizedSegment> result = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      result.add(new DiarizedSegment(segment, DEFAULT_SPEAKER));
    }
    return result;
  }

  static String speakerFor(Segment segment, List<DiarizationTurn> turns) {
    // Sorted so ties resolve to the smallest label regardless of turn order.
    Map<String, Double> overlapBySpeaker = new TreeMap<>();
    for (DiarizationTurn turn : turns) {
      if (turn.speaker() == null) {
        continue;
      }
      double overlap = overlap(segment.start(), segment.end(), turn.start(), turn.end());
      if (overlap > 0) {
        overlapBySpeaker.merge(turn.speaker(), overlap, Double::sum);
      }
    }

    String best = DEFAULT_SPEAKER;
    double bestOverlap = 0.0;
    for (Map.Entry<String, Double> entry : overlapBySpeaker.entrySet()) {
      if (entry.getValue() > bestOverlap) {
        best = entry.getKey();
        bestOverlap = entry.getValue();
      }
    }
    return best;
  }

  static double overlap(double segStart, double segEnd, double turnStart, double turnEnd) {
    return Math.max(0.0, Math.min(segEnd, turnEnd) - Math.max(segStart, turnStart));
  }
}
