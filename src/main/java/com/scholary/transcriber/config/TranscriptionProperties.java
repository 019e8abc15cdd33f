package com.scholary.transcriber.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcription processing.
 *
 * <p>Controls the scratch directory, the default model size and the worker pool. With {@code
 * warmupOnStartup} set, the default model is loaded as soon as the application is ready.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
    @NotBlank String tempDir,
    @NotBlank String defaultModelSize,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    boolean warmupOnStartup) {}
