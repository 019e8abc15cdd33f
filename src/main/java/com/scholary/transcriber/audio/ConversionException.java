package com.scholary.transcriber.audio;

/** Exception thrown when ffmpeg or ffprobe exits non-zero, times out or cannot be started. */
public class ConversionException extends RuntimeException {

  public ConversionException(String message) {
    super(message);
  }

  public ConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
