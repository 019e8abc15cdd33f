package com.scholary.transcriber.pipeline;

import com.scholary.transcriber.job.TranscriptionJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Hands accepted jobs to the worker pool.
 *
 * <p>Lives in its own bean so the {@code @Async} proxy is in play when the controller calls it.
 */
@Component
public class TranscriptionJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionJobRunner.class);

  private final PipelineOrchestrator orchestrator;

  public TranscriptionJobRunner(PipelineOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @Async("taskExecutor")
  public void submit(TranscriptionJob job) {
    LOGGER.info("Picked up job: recordingId={}", job.recordingId());
    orchestrator.run(job);
  }
}
