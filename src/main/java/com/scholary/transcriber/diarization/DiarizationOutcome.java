package com.scholary.transcriber.diarization;

import java.util.List;

/**
 * Result of the diarization stage.
 *
 * <ul>
 *   <li>{@link Kind#FULL}: segments attributed from real speaker turns
 *   <li>{@link Kind#DEGRADED}: every segment carries the default speaker; {@code reason} says why
 *   <li>{@link Kind#FAILED}: the stage could not produce segments at all; fatal for the job
 * </ul>
 */
public record DiarizationOutcome(Kind kind, List<DiarizedSegment> segments, String reason) {

  public enum Kind {
    FULL,
    DEGRADED,
    FAILED
  }

  public DiarizationOutcome {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }

  public static DiarizationOutcome full(List<DiarizedSegment> segments) {
    return new DiarizationOutcome(Kind.FULL, segments, null);
  }

  public static DiarizationOutcome degraded(List<DiarizedSegment> segments, String reason) {
    return new DiarizationOutcome(Kind.DEGRADED, segments, reason);
  }

  public static DiarizationOutcome failed(String reason) {
    return new DiarizationOutcome(Kind.FAILED, List.of(), reason);
  }

  public boolean isFatal() {
    return kind == Kind.FAILED;
  }
}
