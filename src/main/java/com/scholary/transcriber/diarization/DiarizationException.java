package com.scholary.transcriber.diarization;

/**
 * Exception thrown when the diarization server cannot load its pipeline or diarize a file.
 *
 * <p>Never fatal for a job; the engine degrades to single-speaker output instead.
 */
public class DiarizationException extends RuntimeException {

  public DiarizationException(String message) {
    super(message);
  }

  public DiarizationException(String message, Throwable cause) {
    super(message, cause);
  }
}
