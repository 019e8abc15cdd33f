package com.scholary.transcriber.transcription;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.whisper.ModelHandle;
import com.scholary.transcriber.whisper.WhisperException;
import com.scholary.transcriber.whisper.WhisperResponse;
import com.scholary.transcriber.whisper.WhisperSegment;
import com.scholary.transcriber.whisper.WhisperService;
import com.scholary.transcriber.whisper.WhisperWord;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Speech-to-text stage.
 *
 * <p>Loaded models are cached for the life of the process, keyed by resolved size. Caffeine runs
 * the loader at most once per key even when several jobs ask for the same size at the same time;
 * the others block until the first load finishes. A failed load is not cached, so the next job
 * retries it.
 */
@Component
public class TranscriptionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionEngine.class);

  private final WhisperService whisperService;
  private final String defaultModelSize;
  private final Cache<String, ModelHandle> models;

  public TranscriptionEngine(WhisperService whisperService, TranscriptionProperties properties) {
    this.whisperService = whisperService;
    this.defaultModelSize = properties.defaultModelSize();
    this.models = Caffeine.newBuilder().build();
  }

  /**
   * Transcribe canonical audio.
   *
   * @param audio 16 kHz mono PCM
   * @param modelSize requested size, aliased through {@link ModelSizes}
   * @param language ISO code, or null for auto-detection
   * @return ordered segments (possibly none) and the detected language
   * @throws TranscriptionException if the model cannot be loaded or the call fails
   */
  public TranscriptionResult transcribe(Path audio, String modelSize, String language) {
    String resolved = ModelSizes.resolve(modelSize, defaultModelSize);
    if (!ModelSizes.isKnown(modelSize)) {
      LOGGER.warn("Unknown model size '{}', using {}", modelSize, resolved);
    } else if (modelSize != null && !resolved.equals(modelSize)) {
      LOGGER.info("Model size '{}' resolved to {}", modelSize, resolved);
    }

    ModelHandle model = modelFor(resolved);
    String hint = language == null || language.isBlank() ? null : language.trim();

    WhisperResponse response;
    try {
      response = whisperService.transcribe(model, audio, hint);
    } catch (WhisperException e) {
      throw new TranscriptionException("Transcription failed: " + e.getMessage(), e);
    }

    List<Segment> segments = toSegments(response);
    String detected =
        response.language() != null && !response.language().isBlank()
            ? response.language()
            : (hint != null ? hint : "unknown");

    LOGGER.info("Transcribed {} segments, language={}", segments.size(), detected);
    return new TranscriptionResult(segments, detected);
  }

  /**
   * Load a model ahead of the first job that needs it.
   *
   * @throws TranscriptionException if the load fails
   */
  public void preload(String modelSize) {
    modelFor(ModelSizes.resolve(modelSize, defaultModelSize));
  }

  /** True once at least one model has finished loading. */
  public boolean isWarm() {
    return models.estimatedSize() > 0;
  }

  ModelHandle modelFor(String resolvedSize) {
    try {
      return models.get(
          resolvedSize,
          size -> {
            LOGGER.info("Model cache miss, loading: {}", size);
            return whisperService.loadModel(size);
          });
    } catch (WhisperException e) {
      throw new TranscriptionException(
          "Failed to load model " + resolvedSize + ": " + e.getMessage(), e);
    }
  }

  private static List<Segment> toSegments(WhisperResponse response) {
    List<Segment> segments = new ArrayList<>();
    if (response.segments() == null) {
      return segments;
    }
    for (WhisperSegment raw : response.segments()) {
      List<Word> words = new ArrayList<>();
      if (raw.words() != null) {
        for (WhisperWord w : raw.words()) {
          words.add(Word.of(w.word(), w.start(), w.end(), w.probability()));
        }
      }
      double end = Math.max(raw.start(), raw.end());
      segments.add(new Segment(raw.start(), end, raw.text(), words));
    }
    segments.sort(Comparator.comparingDouble(Segment::start));
    return segments;
  }
}
