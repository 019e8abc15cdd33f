package com.scholary.transcriber.diarization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcriber.http.HttpExchanges;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the pyannote diarization server.
 *
 * <p>The server needs the model hub token to fetch gated pipelines, so every call carries it as a
 * bearer token. No retries: the engine degrades instead.
 */
@Component
public class DiarizationClient implements DiarizationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(DiarizationClient.class);

  private final DiarizationProperties properties;
  private final ObjectMapper objectMapper;
  private final HttpClient httpClient;

  public DiarizationClient(DiarizationProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();
  }

  @Override
  public PipelineHandle loadPipeline(String model) {
    try {
      byte[] body = objectMapper.writeValueAsBytes(Map.of("model", model));
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/api/v1/pipelines/load"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Authorization", "Bearer " + properties.authToken())
              .header("Content-Type", "application/json")
              .POST(BodyPublishers.ofByteArray(body))
              .build();

      HttpResponse<byte[]> response =
          HttpExchanges.send(
              httpClient,
              request,
              HttpResponse.BodyHandlers.ofByteArray(),
              Duration.ofSeconds(properties.readTimeout()));
      if (response.statusCode() != 200) {
        throw new DiarizationException(
            String.format(
                "Pipeline load returned status %d: %s",
                response.statusCode(), new String(response.body(), StandardCharsets.UTF_8)));
      }
      PipelineHandle handle = objectMapper.readValue(response.body(), PipelineHandle.class);
      LOGGER.info("Loaded diarization pipeline {} on {}", handle.pipeline(), handle.device());
      return handle;

    } catch (IOException e) {
      throw new DiarizationException("Failed to load diarization pipeline " + model, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DiarizationException("Pipeline load interrupted", e);
    }
  }

  @Override
  public List<DiarizationTurn> diarize(
      PipelineHandle pipeline, Path audioFile, Integer numSpeakers) {
    try {
      String boundary = UUID.randomUUID().toString();
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/api/v1/diarize"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Authorization", "Bearer " + properties.authToken())
              .header("Content-Type", "multipart/form-data; boundary=" + boundary)
              .POST(multipart(pipeline, audioFile, numSpeakers, boundary))
              .build();

      LOGGER.debug(
          "Diarizing {} with {} (numSpeakers={})",
          audioFile.getFileName(),
          pipeline.pipeline(),
          numSpeakers);

      HttpResponse<byte[]> response =
          HttpExchanges.send(
              httpClient,
              request,
              HttpResponse.BodyHandlers.ofByteArray(),
              Duration.ofSeconds(properties.readTimeout()));
      if (response.statusCode() != 200) {
        throw new DiarizationException(
            String.format(
                "Diarization returned status %d: %s",
                response.statusCode(), new String(response.body(), StandardCharsets.UTF_8)));
      }
      DiarizationResponse parsed =
          objectMapper.readValue(response.body(), DiarizationResponse.class);
      return parsed.turns() == null ? List.of() : parsed.turns();

    } catch (IOException e) {
      throw new DiarizationException("Diarization request failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DiarizationException("Diarization interrupted", e);
    }
  }

  private static BodyPublisher multipart(
      PipelineHandle pipeline, Path audioFile, Integer numSpeakers, String boundary)
      throws IOException {
    StringBuilder head = new StringBuilder();
    head.append("--").append(boundary).append("\r\n");
    head.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(audioFile.getFileName())
        .append("\"\r\n");
    head.append("Content-Type: audio/wav\r\n\r\n");

    StringBuilder tail = new StringBuilder("\r\n");
    field(tail, boundary, "pipeline", pipeline.pipeline());
    if (numSpeakers != null) {
      field(tail, boundary, "num_speakers", String.valueOf(numSpeakers));
    }
    tail.append("--").append(boundary).append("--\r\n");

    byte[] prefix = head.toString().getBytes(StandardCharsets.UTF_8);
    byte[] suffix = tail.toString().getBytes(StandardCharsets.UTF_8);
    return BodyPublishers.concat(
        BodyPublishers.ofByteArray(prefix),
        BodyPublishers.ofFile(audioFile),
        BodyPublishers.ofByteArray(suffix));
  }

  private static void field(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }
}
