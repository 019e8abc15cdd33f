package com.scholary.transcriber.audio;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg and ffprobe.
 *
 * <p>The defaults produce what the recognizer expects: 16 kHz mono 16-bit PCM.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @Positive int sampleRate,
    @Positive int channels,
    @Positive int timeoutSeconds) {}
