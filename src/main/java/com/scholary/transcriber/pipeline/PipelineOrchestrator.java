package com.scholary.transcriber.pipeline;

import com.scholary.transcriber.audio.AudioConverter;
import com.scholary.transcriber.audio.ConversionException;
import com.scholary.transcriber.audio.DurationProbe;
import com.scholary.transcriber.callback.CallbackNotifier;
import com.scholary.transcriber.callback.ResultEnvelope;
import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.diarization.DiarizationEngine;
import com.scholary.transcriber.diarization.DiarizationOutcome;
import com.scholary.transcriber.download.MediaDownloader;
import com.scholary.transcriber.job.JobScratch;
import com.scholary.transcriber.job.JobTracker;
import com.scholary.transcriber.job.TranscriptionJob;
import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.output.FormattedTranscript;
import com.scholary.transcriber.output.OutputFormatter;
import com.scholary.transcriber.transcription.Segment;
import com.scholary.transcriber.transcription.TranscriptionEngine;
import com.scholary.transcriber.transcription.TranscriptionResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one job end to end.
 *
 * <p>Stages run in order: download, convert, transcribe, diarize, format, duration probe. A failure
 * in any stage except diarization ends the job with an error envelope and skips the rest. Whatever
 * happens, the job's scratch files are removed and then exactly one callback is attempted.
 */
@Service
public class PipelineOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final MediaDownloader downloader;
  private final AudioConverter converter;
  private final TranscriptionEngine transcriptionEngine;
  private final DiarizationEngine diarizationEngine;
  private final OutputFormatter outputFormatter;
  private final DurationProbe durationProbe;
  private final CallbackNotifier callbackNotifier;
  private final JobTracker jobTracker;
  private final Path tempDir;

  public PipelineOrchestrator(
      MediaDownloader downloader,
      AudioConverter converter,
      TranscriptionEngine transcriptionEngine,
      DiarizationEngine diarizationEngine,
      OutputFormatter outputFormatter,
      DurationProbe durationProbe,
      CallbackNotifier callbackNotifier,
      JobTracker jobTracker,
      TranscriptionProperties properties) {
    this.downloader = downloader;
    this.converter = converter;
    this.transcriptionEngine = transcriptionEngine;
    this.diarizationEngine = diarizationEngine;
    this.outputFormatter = outputFormatter;
    this.durationProbe = durationProbe;
    this.callbackNotifier = callbackNotifier;
    this.jobTracker = jobTracker;
    this.tempDir = Paths.get(properties.tempDir());

    try {
      Files.createDirectories(this.tempDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create temp directory: " + tempDir, e);
    }
  }

  /**
   * Run a job. Never throws; the outcome is reported through the callback.
   *
   * @param job the job to run
   * @return the envelope that was sent to the callback
   */
  public ResultEnvelope run(TranscriptionJob job) {
    long startedNanos = System.nanoTime();
    String runId = UUID.randomUUID().toString();
    StructuredLogger.setJobContext(runId, job.recordingId());
    jobTracker.jobStarted();

    ResultEnvelope envelope = null;
    try {
      LOGGER.info("Starting job: {}", job);
      envelope = execute(job, runId, startedNanos);
    } finally {
      if (envelope == null) {
        envelope =
            ResultEnvelope.error(
                job.recordingId(), "Internal error", processingSeconds(startedNanos));
      }
      try {
        callbackNotifier.notify(job.callbackUrl(), job.callbackSecret(), envelope);
      } finally {
        jobTracker.jobFinished();
        StructuredLogger.clearJobContext();
      }
    }
    return envelope;
  }

  private ResultEnvelope execute(TranscriptionJob job, String runId, long startedNanos) {
    try {
      ResultEnvelope envelope = process(job, runId, startedNanos);
      structuredLogger.logJobFinished(
          envelope.status(),
          envelope.processingSeconds(),
          envelope.transcriptUtterances().size());
      return envelope;

    } catch (PipelineException e) {
      structuredLogger.logStageFailed(
          e.getStage().label(), errorType(e), e.getMessage());
      return failure(job, e.getMessage(), startedNanos);

    } catch (RuntimeException e) {
      LOGGER.error("Job failed unexpectedly", e);
      return failure(job, messageOf(e), startedNanos);

    } finally {
      JobScratch.cleanup(tempDir, job.recordingId(), runId);
    }
  }

  private ResultEnvelope process(TranscriptionJob job, String runId, long startedNanos) {
    JobScratch scratch =
        stage(PipelineStage.SETUP, () -> JobScratch.open(tempDir, job.recordingId(), runId));

    stage(PipelineStage.DOWNLOAD, () -> downloader.download(job.source(), scratch.inputFile()));

    Path audio =
        stage(
            PipelineStage.CONVERT,
            () -> converter.convert(scratch.inputFile(), scratch.audioFile()));

    TranscriptionResult transcription =
        stage(
            PipelineStage.TRANSCRIBE,
            () -> transcriptionEngine.transcribe(audio, job.modelSize(), job.language()));

    DiarizationOutcome outcome =
        stage(
            PipelineStage.DIARIZE,
            () -> diarizationEngine.diarize(audio, transcription.segments(), job.numSpeakers()));
    if (outcome.isFatal()) {
      throw new PipelineException(PipelineStage.DIARIZE, outcome.reason());
    }
    if (outcome.kind() == DiarizationOutcome.Kind.DEGRADED) {
      structuredLogger.logDiarizationDegraded(outcome.reason());
    }

    FormattedTranscript transcript =
        stage(PipelineStage.FORMAT, () -> outputFormatter.format(outcome.segments()));

    double duration =
        stage(
            PipelineStage.DURATION_PROBE,
            () -> probeDuration(audio, transcription.segments()));

    return ResultEnvelope.success(
        job.recordingId(),
        transcript,
        duration,
        transcription.language(),
        processingSeconds(startedNanos));
  }

  private double probeDuration(Path audio, List<Segment> segments) {
    try {
      return round(durationProbe.probe(audio), 3);
    } catch (ConversionException e) {
      double fallback = segments.isEmpty() ? 0.0 : segments.get(segments.size() - 1).end();
      LOGGER.warn("Duration probe failed, using last segment end {}s: {}", fallback, e.getMessage());
      return round(fallback, 3);
    }
  }

  private <T> T stage(PipelineStage stage, Supplier<T> action) {
    structuredLogger.logStageStarted(stage.label());
    long start = System.currentTimeMillis();
    try {
      T result = action.get();
      structuredLogger.logStageFinished(stage.label(), System.currentTimeMillis() - start);
      return result;
    } catch (PipelineException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new PipelineException(stage, messageOf(e), e);
    }
  }

  private ResultEnvelope failure(TranscriptionJob job, String error, long startedNanos) {
    ResultEnvelope envelope =
        ResultEnvelope.error(job.recordingId(), error, processingSeconds(startedNanos));
    structuredLogger.logJobFinished(envelope.status(), envelope.processingSeconds(), 0);
    return envelope;
  }

  private static String errorType(PipelineException e) {
    return e.getCause() != null ? e.getCause().getClass().getSimpleName() : "PipelineException";
  }

  private static String messageOf(Throwable e) {
    return e.getMessage() != null && !e.getMessage().isBlank()
        ? e.getMessage()
        : e.getClass().getSimpleName();
  }

  private static double processingSeconds(long startedNanos) {
    return round((System.nanoTime() - startedNanos) / 1_000_000_000.0, 2);
  }

  private static double round(double value, int decimals) {
    double scale = Math.pow(10, decimals);
    return Math.round(value * scale) / scale;
  }
}
