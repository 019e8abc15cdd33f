package com.scholary.transcriber.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.transcriber.job.TranscriptionJob;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Request for transcribing one recording.
 *
 * <p>One of {@code audio_url} or {@code video_url} is required; audio wins when both are given.
 * The result is delivered to {@code callback_url}, signed with {@code callback_secret}.
 */
public record TranscriptionJobRequest(
    @JsonProperty("recording_id") @NotBlank String recordingId,
    @JsonProperty("audio_url") String audioUrl,
    @JsonProperty("video_url") String videoUrl,
    @JsonProperty("language") String language,
    @JsonProperty("model_size") String modelSize,
    @JsonProperty("num_speakers") @Positive Integer numSpeakers,
    @JsonProperty("callback_url") @NotBlank String callbackUrl,
    @JsonProperty("callback_secret") @NotBlank String callbackSecret) {

  /**
   * Build the job for this request.
   *
   * @param defaultModelSize used when no model size was requested
   * @throws com.scholary.transcriber.job.InvalidJobException if no media reference was given
   */
  public TranscriptionJob toJob(String defaultModelSize) {
    String size = modelSize == null || modelSize.isBlank() ? defaultModelSize : modelSize.trim();
    String lang = language == null || language.isBlank() ? null : language.trim();
    return new TranscriptionJob(
        recordingId,
        TranscriptionJob.chooseSource(audioUrl, videoUrl),
        lang,
        size,
        numSpeakers,
        callbackUrl,
        callbackSecret);
  }
}
