package com.scholary.transcriber.diarization;

import java.nio.file.Path;
import java.util.List;

/** Port to the external diarization engine. */
public interface DiarizationService {

  /**
   * Load the diarization pipeline. Expensive; callers cache the returned handle.
   *
   * @throws DiarizationException if the load fails
   */
  PipelineHandle loadPipeline(String model);

  /**
   * Run diarization over an audio file.
   *
   * @param pipeline a loaded pipeline
   * @param audioFile canonical PCM audio
   * @param numSpeakers expected speaker count, or null to let the engine decide
   * @return speaker turns, in no particular order
   * @throws DiarizationException if the call fails
   */
  List<DiarizationTurn> diarize(PipelineHandle pipeline, Path audioFile, Integer numSpeakers);
}
