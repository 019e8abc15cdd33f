package com.scholary.transcriber.pipeline;

import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.transcription.TranscriptionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Loads the default recognition model once the application is up, so the first job does not pay
 * the load cost. Failure is logged; the first job will try again.
 */
@Component
public class ModelWarmup {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModelWarmup.class);

  private final TranscriptionEngine transcriptionEngine;
  private final TranscriptionProperties properties;

  public ModelWarmup(TranscriptionEngine transcriptionEngine, TranscriptionProperties properties) {
    this.transcriptionEngine = transcriptionEngine;
    this.properties = properties;
  }

  @Async("taskExecutor")
  @EventListener(ApplicationReadyEvent.class)
  public void warmUp() {
    if (!properties.warmupOnStartup()) {
      return;
    }
    try {
      transcriptionEngine.preload(properties.defaultModelSize());
      LOGGER.info("Default model warm: {}", properties.defaultModelSize());
    } catch (RuntimeException e) {
      LOGGER.warn("Model warm-up failed: {}", e.getMessage());
    }
  }
}
