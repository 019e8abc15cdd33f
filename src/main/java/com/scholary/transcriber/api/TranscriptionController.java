package com.scholary.transcriber.api;

import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.job.JobTracker;
import com.scholary.transcriber.job.TranscriptionJob;
import com.scholary.transcriber.pipeline.TranscriptionJobRunner;
import com.scholary.transcriber.transcription.TranscriptionEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for transcription jobs.
 *
 * <p>Jobs are accepted and queued immediately. There is no status endpoint: the outcome of every
 * accepted job is delivered once to its callback URL.
 */
@RestController
@Tag(name = "Transcription", description = "Transcription and speaker diarization API")
public class TranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionController.class);

  private final TranscriptionJobRunner jobRunner;
  private final TranscriptionEngine transcriptionEngine;
  private final JobTracker jobTracker;
  private final TranscriptionProperties properties;

  public TranscriptionController(
      TranscriptionJobRunner jobRunner,
      TranscriptionEngine transcriptionEngine,
      JobTracker jobTracker,
      TranscriptionProperties properties) {
    this.jobRunner = jobRunner;
    this.transcriptionEngine = transcriptionEngine;
    this.jobTracker = jobTracker;
    this.properties = properties;
  }

  @PostMapping("/transcribe")
  @Operation(
      summary = "Start transcription",
      description = "Queue a recording for transcription; the result is posted to callback_url")
  public ResponseEntity<JobAcceptedResponse> transcribe(
      @Valid @RequestBody TranscriptionJobRequest request) {
    TranscriptionJob job = request.toJob(properties.defaultModelSize());
    LOGGER.info("Accepted job: recordingId={}, model={}", job.recordingId(), job.modelSize());

    jobRunner.submit(job);

    return ResponseEntity.accepted().body(JobAcceptedResponse.accepted(job.recordingId()));
  }

  @GetMapping("/health")
  @Operation(summary = "Readiness", description = "Model warm state and in-flight job count")
  public HealthResponse health() {
    return new HealthResponse("ok", transcriptionEngine.isWarm(), jobTracker.activeJobs());
  }
}
