package com.scholary.transcriber.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcriber.http.HttpExchanges;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the faster-whisper recognition server.
 *
 * <p>Handles the low-level HTTP communication: building multipart requests, sending files, parsing
 * responses, and retrying transient I/O failures. Non-200 responses are not retried.
 */
@Component
public class WhisperClient implements WhisperService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized Whisper client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public ModelHandle loadModel(String modelName) {
    LOGGER.info("Loading recognition model: {}", modelName);
    long start = System.currentTimeMillis();

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(
                URI.create(
                    properties.baseUrl()
                        + "/api/v1/models/"
                        + URLEncoder.encode(modelName, StandardCharsets.UTF_8)
                        + "/load"))
            .timeout(Duration.ofSeconds(properties.loadTimeout()))
            .POST(BodyPublishers.noBody())
            .build();

    try {
      HttpResponse<String> response =
          HttpExchanges.send(
              httpClient,
              request,
              HttpResponse.BodyHandlers.ofString(),
              Duration.ofSeconds(properties.loadTimeout()));
      if (response.statusCode() != 200) {
        throw new WhisperException(
            String.format(
                "Model load returned status %d: %s", response.statusCode(), response.body()));
      }
      ModelHandle handle = objectMapper.readValue(response.body(), ModelHandle.class);
      LOGGER.info(
          "Loaded model {} on {} in {}ms",
          handle.model(),
          handle.device(),
          System.currentTimeMillis() - start);
      return handle;
    } catch (IOException e) {
      throw new WhisperException("Failed to load model " + modelName, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WhisperException("Model load interrupted", e);
    }
  }

  /**
   * Transcribe an audio file.
   *
   * <p>Sends the audio file as multipart/form-data and returns the parsed response. I/O failures
   * are retried with exponential backoff up to {@code maxRetries} attempts.
   *
   * @throws WhisperException if transcription fails after retries
   */
  @Override
  public WhisperResponse transcribe(ModelHandle model, Path audioFile, String language) {
    LOGGER.info(
        "Transcribing: file={}, model={}, language={}",
        audioFile.getFileName(),
        model.model(),
        language == null ? "auto" : language);

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptTranscribe(model, audioFile, language);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "Transcription attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new WhisperException("Transcription interrupted", ie);
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new WhisperException("Transcription interrupted", e);
      }
    }

    throw new WhisperException(
        String.format("Transcription failed after %d attempts", properties.maxRetries()),
        lastException);
  }

  private WhisperResponse attemptTranscribe(ModelHandle model, Path audioFile, String language)
      throws IOException, InterruptedException {

    String boundary = UUID.randomUUID().toString();
    BodyPublisher bodyPublisher = buildMultipartBody(model, audioFile, language, boundary);

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(bodyPublisher)
            .build();

    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<byte[]> response =
        HttpExchanges.send(
            httpClient,
            request,
            HttpResponse.BodyHandlers.ofByteArray(),
            Duration.ofSeconds(properties.readTimeout()));

    if (response.statusCode() != 200) {
      throw new WhisperException(
          String.format(
              "Whisper API returned status %d: %s",
              response.statusCode(), new String(response.body(), StandardCharsets.UTF_8)));
    }

    WhisperResponse whisperResponse =
        objectMapper.readValue(response.body(), WhisperResponse.class);

    LOGGER.info(
        "Transcription successful: {} segments, language={}",
        whisperResponse.segments() == null ? 0 : whisperResponse.segments().size(),
        whisperResponse.language());

    return whisperResponse;
  }

  /**
   * Build a multipart/form-data body.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="rec_audio.wav"
   * Content-Type: audio/wav
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="model"
   *
   * medium
   * --boundary
   * Content-Disposition: form-data; name="word_timestamps"
   *
   * true
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(
      ModelHandle model, Path audioFile, String language, String boundary) throws IOException {

    String filename = audioFile.getFileName().toString();

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(filename)
        .append("\"\r\n");
    sb.append("Content-Type: audio/wav\r\n\r\n");

    byte[] prefix = sb.toString().getBytes(StandardCharsets.UTF_8);

    sb = new StringBuilder();
    sb.append("\r\n");
    appendField(sb, boundary, "model", model.model());
    appendField(sb, boundary, "word_timestamps", "true");
    if (language != null && !language.isBlank()) {
      appendField(sb, boundary, "language", language);
    }
    sb.append("--").append(boundary).append("--\r\n");

    byte[] suffix = sb.toString().getBytes(StandardCharsets.UTF_8);

    // the audio part is streamed from disk
    return BodyPublishers.concat(
        BodyPublishers.ofByteArray(prefix),
        BodyPublishers.ofFile(audioFile),
        BodyPublishers.ofByteArray(suffix));
  }

  private static void appendField(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }
}
