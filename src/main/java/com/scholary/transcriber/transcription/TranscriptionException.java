package com.scholary.transcriber.transcription;

/** Exception thrown when the recognizer cannot load a model or transcribe the audio. */
public class TranscriptionException extends RuntimeException {

  public TranscriptionException(String message) {
    super(message);
  }

  public TranscriptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
