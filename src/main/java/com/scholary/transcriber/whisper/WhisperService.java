package com.scholary.transcriber.whisper;

import java.nio.file.Path;

/**
 * Port to the external speech recognition engine.
 *
 * <p>This abstraction allows us to swap recognition backends without changing the pipeline.
 */
public interface WhisperService {

  /**
   * Load a model on the server. Expensive; callers cache the returned handle.
   *
   * @param modelName a model name the server supports
   * @return the handle for the resident model
   * @throws WhisperException if the load fails
   */
  ModelHandle loadModel(String modelName);

  /**
   * Transcribe an audio file with word-level timestamps.
   *
   * @param model a loaded model
   * @param audioFile canonical PCM audio
   * @param language ISO language code, or null to let the server detect it
   * @return the transcription response
   * @throws WhisperException if transcription fails
   */
  WhisperResponse transcribe(ModelHandle model, Path audioFile, String language);
}
