package com.scholary.transcriber.diarization;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.transcriber.transcription.Segment;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Speaker attribution stage.
 *
 * <p>Model problems never fail a job. Without a configured credential the model is not called at
 * all; a load or invocation failure is logged and the job continues with one speaker. The loaded
 * pipeline is cached for the life of the process and loaded at most once, even under concurrent
 * first use.
 */
@Component
public class DiarizationEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(DiarizationEngine.class);

  private final DiarizationService diarizationService;
  private final DiarizationProperties properties;
  private final Cache<String, PipelineHandle> pipelines;

  public DiarizationEngine(
      DiarizationService diarizationService, DiarizationProperties properties) {
    this.diarizationService = diarizationService;
    this.properties = properties;
    this.pipelines = Caffeine.newBuilder().build();

    if (!properties.isConfigured()) {
      LOGGER.warn("Diarization is not configured; all utterances will use {}",
          SpeakerAssigner.DEFAULT_SPEAKER);
    }
  }

  /**
   * Attribute each segment to a speaker.
   *
   * @param audio canonical PCM audio
   * @param segments transcript segments in start order
   * @param numSpeakers expected speaker count; forwarded only when positive
   * @return the outcome; only {@link DiarizationOutcome.Kind#FAILED} should stop the job
   */
  public DiarizationOutcome diarize(Path audio, List<Segment> segments, Integer numSpeakers) {
    if (segments.isEmpty()) {
      return DiarizationOutcome.full(List.of());
    }
    if (!Files.isRegularFile(audio)) {
      return DiarizationOutcome.failed("Audio for diarization is missing: " + audio.getFileName());
    }
    if (!properties.isConfigured()) {
      return DiarizationOutcome.degraded(
          SpeakerAssigner.assignDefault(segments), "diarization not configured");
    }

    Integer hint = numSpeakers != null && numSpeakers > 0 ? numSpeakers : null;
    try {
      PipelineHandle pipeline =
          pipelines.get(
              properties.model(),
              model -> {
                LOGGER.info("Loading diarization pipeline: {}", model);
                return diarizationService.loadPipeline(model);
              });

      List<DiarizationTurn> turns = diarizationService.diarize(pipeline, audio, hint);
      List<DiarizedSegment> attributed = SpeakerAssigner.assign(segments, turns);

      LOGGER.info(
          "Diarization produced {} turns across {} speakers",
          turns.size(),
          turns.stream().map(DiarizationTurn::speaker).distinct().count());
      return DiarizationOutcome.full(attributed);

    } catch (RuntimeException e) {
      LOGGER.warn("Diarization failed, falling back to single speaker: {}", e.getMessage(), e);
      return DiarizationOutcome.degraded(
          SpeakerAssigner.assignDefault(segments), "diarization failed: " + e.getMessage());
    }
  }

  /** True once the diarization pipeline has been loaded. */
  public boolean isWarm() {
    return pipelines.estimatedSize() > 0;
  }
}
