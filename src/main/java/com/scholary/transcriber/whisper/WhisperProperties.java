package com.scholary.transcriber.whisper;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the speech recognition server client.
 *
 * <p>Timeouts are in seconds. Model loads get their own, longer timeout because the first load of
 * a large model can take minutes.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int loadTimeout,
    @Positive int maxRetries) {}
