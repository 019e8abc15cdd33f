package com.scholary.transcriber.job;

/**
 * A unit of work: one recording to transcribe and one webhook to notify.
 *
 * <p>Exists only while its pipeline runs.
 *
 * @param recordingId job identifier
 * @param source the chosen media reference (audio preferred over video)
 * @param language ISO language hint, null for auto-detection
 * @param modelSize requested recognizer size
 * @param numSpeakers expected speaker count, null when unknown
 * @param callbackUrl webhook destination
 * @param callbackSecret webhook signing secret
 */
public record TranscriptionJob(
    String recordingId,
    String source,
    String language,
    String modelSize,
    Integer numSpeakers,
    String callbackUrl,
    String callbackSecret) {

  public TranscriptionJob {
    if (recordingId == null || recordingId.isBlank()) {
      throw new InvalidJobException("recording_id is required");
    }
    if (source == null || source.isBlank()) {
      throw new InvalidJobException("audio_url or video_url is required");
    }
    if (callbackUrl == null || callbackUrl.isBlank()) {
      throw new InvalidJobException("callback_url is required");
    }
    if (callbackSecret == null || callbackSecret.isBlank()) {
      throw new InvalidJobException("callback_secret is required");
    }
    if (numSpeakers != null && numSpeakers <= 0) {
      throw new InvalidJobException("num_speakers must be a positive integer");
    }
  }

  /**
   * Pick the media reference to process.
   *
   * @return the audio URL when present, otherwise the video URL
   * @throws InvalidJobException when neither is present
   */
  public static String chooseSource(String audioUrl, String videoUrl) {
    if (audioUrl != null && !audioUrl.isBlank()) {
      return audioUrl.trim();
    }
    if (videoUrl != null && !videoUrl.isBlank()) {
      return videoUrl.trim();
    }
    throw new InvalidJobException("audio_url or video_url is required");
  }

  @Override
  public String toString() {
    return "TranscriptionJob[recordingId=" + recordingId + ", modelSize=" + modelSize + "]";
  }
}
