package com.scholary.transcriber.transcription;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.whisper.ModelHandle;
import com.scholary.transcriber.whisper.WhisperException;
import com.scholary.transcriber.whisper.WhisperResponse;
import com.scholary.transcriber.whisper.WhisperSegment;
import com.scholary.transcriber.whisper.WhisperService;
import com.scholary.transcriber.whisper.WhisperWord;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscriptionEngineTest {

  private static final Path AUDIO = Path.of("/tmp/audio.wav");
  private static final ModelHandle LARGE = new ModelHandle("large", "cuda");
  private static final ModelHandle MEDIUM = new ModelHandle("medium", "cuda");

  @Mock private WhisperService whisperService;

  private TranscriptionEngine engine;

  @BeforeEach
  void setUp() {
    engine =
        new TranscriptionEngine(
            whisperService, new TranscriptionProperties("/tmp", "medium", 2, 10, false));
  }

  @Test
  void transcribe_shouldMapSegmentsAndWords() {
    when(whisperService.loadModel("medium")).thenReturn(MEDIUM);
    when(whisperService.transcribe(MEDIUM, AUDIO, null))
        .thenReturn(
            new WhisperResponse(
                List.of(
                    new WhisperSegment(
                        3.0,
                        5.0,
                        " second",
                        List.of(new WhisperWord(" second", 3.0, 3.6, 0.91))),
                    new WhisperSegment(
                        0.0,
                        2.0,
                        " first",
                        List.of(new WhisperWord(" first", 0.1, null, 0.72)))),
                "en"));

    TranscriptionResult result = engine.transcribe(AUDIO, "medium", null);

    assertThat(result.language()).isEqualTo("en");
    assertThat(result.segments()).extracting(Segment::text).containsExactly(" first", " second");
    Word first = result.segments().get(0).words().get(0);
    assertThat(first.isTimed()).isFalse();
    assertThat(first.start()).hasValue(0.1);
    assertThat(first.probability()).hasValue(0.72);
  }

  @Test
  void transcribe_shouldResolveAliasBeforeLoading() {
    when(whisperService.loadModel("large")).thenReturn(LARGE);
    when(whisperService.transcribe(eq(LARGE), eq(AUDIO), any()))
        .thenReturn(new WhisperResponse(List.of(), "de"));

    engine.transcribe(AUDIO, "large-v3", "de");
    engine.transcribe(AUDIO, "turbo", null);
    engine.transcribe(AUDIO, "large", null);

    verify(whisperService, times(1)).loadModel("large");
    assertThat(engine.isWarm()).isTrue();
  }

  @Test
  void transcribe_shouldAcceptZeroSegments() {
    when(whisperService.loadModel("medium")).thenReturn(MEDIUM);
    when(whisperService.transcribe(MEDIUM, AUDIO, null)).thenReturn(new WhisperResponse(null, "fr"));

    TranscriptionResult result = engine.transcribe(AUDIO, null, null);

    assertThat(result.segments()).isEmpty();
    assertThat(result.language()).isEqualTo("fr");
  }

  @Test
  void transcribe_shouldFallBackToHintThenUnknownForLanguage() {
    when(whisperService.loadModel("medium")).thenReturn(MEDIUM);
    when(whisperService.transcribe(eq(MEDIUM), eq(AUDIO), any()))
        .thenReturn(new WhisperResponse(List.of(), null));

    assertThat(engine.transcribe(AUDIO, "medium", "es").language()).isEqualTo("es");
    assertThat(engine.transcribe(AUDIO, "medium", " ").language()).isEqualTo("unknown");
    verify(whisperService).transcribe(eq(MEDIUM), eq(AUDIO), isNull());
  }

  @Test
  void transcribe_shouldWrapServerFailures() {
    when(whisperService.loadModel("medium")).thenReturn(MEDIUM);
    when(whisperService.transcribe(MEDIUM, AUDIO, null))
        .thenThrow(new WhisperException("Transcription failed with status 500"));

    assertThatThrownBy(() -> engine.transcribe(AUDIO, "medium", null))
        .isInstanceOf(TranscriptionException.class)
        .hasMessageContaining("status 500")
        .hasCauseInstanceOf(WhisperException.class);
  }

  @Test
  void transcribe_shouldNotCacheFailedLoads() {
    when(whisperService.loadModel("medium"))
        .thenThrow(new WhisperException("out of memory"))
        .thenReturn(MEDIUM);
    when(whisperService.transcribe(MEDIUM, AUDIO, null))
        .thenReturn(new WhisperResponse(List.of(), "en"));

    assertThatThrownBy(() -> engine.transcribe(AUDIO, "medium", null))
        .isInstanceOf(TranscriptionException.class)
        .hasMessageContaining("Failed to load model medium");
    assertThat(engine.isWarm()).isFalse();

    assertThat(engine.transcribe(AUDIO, "medium", null).language()).isEqualTo("en");
    verify(whisperService, times(2)).loadModel("medium");
  }

  @Test
  void modelFor_shouldLoadOnceUnderConcurrentFirstUse() throws Exception {
    when(whisperService.loadModel("large"))
        .thenAnswer(
            invocation -> {
              Thread.sleep(200);
              return LARGE;
            });

    int jobs = 8;
    ExecutorService executor = Executors.newFixedThreadPool(jobs);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<ModelHandle>> futures = new ArrayList<>();
      for (int i = 0; i < jobs; i++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  return engine.modelFor("large");
                }));
      }
      start.countDown();
      for (Future<ModelHandle> future : futures) {
        assertThat(future.get()).isSameAs(LARGE);
      }
    } finally {
      executor.shutdownNow();
    }

    verify(whisperService, times(1)).loadModel("large");
  }

  @Test
  void preload_shouldWarmTheCache() {
    when(whisperService.loadModel("medium")).thenReturn(MEDIUM);

    assertThat(engine.isWarm()).isFalse();
    engine.preload("medium.en");

    assertThat(engine.isWarm()).isTrue();
  }
}
