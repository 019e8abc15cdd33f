package com.scholary.transcriber.diarization;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the diarization server client.
 *
 * <p>A blank {@code authToken} means diarization is not configured: jobs still run, with every
 * utterance attributed to a single speaker.
 */
@ConfigurationProperties(prefix = "diarization")
@Validated
public record DiarizationProperties(
    String baseUrl,
    String authToken,
    @NotBlank String model,
    @Positive int connectTimeout,
    @Positive int readTimeout) {

  public boolean isConfigured() {
    return authToken != null
        && !authToken.isBlank()
        && baseUrl != null
        && !baseUrl.isBlank();
  }
}
