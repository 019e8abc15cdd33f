package com.scholary.transcriber.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Emits pipeline events with structured fields so a job can be followed stage by stage in the
 * log aggregator.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log stage started event. */
  public void logStageStarted(String stage) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("stage", stage);

      logger.info("Stage started: {}", stage);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage finished event. */
  public void logStageFinished(String stage, long elapsedMs) {
    try {
      MDC.put("event_type", "stage_finished");
      MDC.put("stage", stage);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Stage finished: {} in {}ms", stage, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage failure event. */
  public void logStageFailed(String stage, String errorType, String message) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("stage", stage);
      MDC.put("errorType", errorType);

      logger.error("Stage failed: stage={}, error={}, message={}", stage, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log diarization degradation. */
  public void logDiarizationDegraded(String reason) {
    try {
      MDC.put("event_type", "diarization_degraded");
      MDC.put("reason", reason);

      logger.warn("Diarization degraded to single speaker: {}", reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log job finished event. */
  public void logJobFinished(String status, double processingSeconds, int utterances) {
    try {
      MDC.put("event_type", "job_finished");
      MDC.put("status", status);
      MDC.put("processingSeconds", String.valueOf(processingSeconds));
      MDC.put("utterances", String.valueOf(utterances));

      logger.info(
          "Job finished: status={}, processing={}s, utterances={}",
          status,
          processingSeconds,
          utterances);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String recordingId) {
    MDC.put("jobId", jobId);
    MDC.put("recordingId", recordingId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("recordingId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("stage");
    MDC.remove("elapsedMs");
    MDC.remove("errorType");
    MDC.remove("reason");
    MDC.remove("status");
    MDC.remove("processingSeconds");
    MDC.remove("utterances");
  }
}
