package com.scholary.transcriber.callback;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.transcriber.output.FormattedTranscript;
import com.scholary.transcriber.output.TranscriptJson;
import com.scholary.transcriber.output.Utterance;
import java.util.List;

/**
 * Body of the completion webhook.
 *
 * <p>Success envelopes carry the transcript fields, error envelopes carry {@code error}. Both carry
 * {@code processing_seconds}. Fields that do not apply are left out of the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResultEnvelope(
    @JsonProperty("recording_id") String recordingId,
    @JsonProperty("status") String status,
    @JsonProperty("transcript_text") String transcriptText,
    @JsonProperty("transcript_json") TranscriptJson transcriptJson,
    @JsonProperty("transcript_utterances") List<Utterance> transcriptUtterances,
    @JsonProperty("duration_seconds") Double durationSeconds,
    @JsonProperty("language") String language,
    @JsonProperty("word_count") Integer wordCount,
    @JsonProperty("speaker_count") Integer speakerCount,
    @JsonProperty("error") String error,
    @JsonProperty("processing_seconds") double processingSeconds) {

  public static final String SUCCESS = "success";
  public static final String ERROR = "error";

  public static ResultEnvelope success(
      String recordingId,
      FormattedTranscript transcript,
      double durationSeconds,
      String language,
      double processingSeconds) {
    return new ResultEnvelope(
        recordingId,
        SUCCESS,
        transcript.transcriptText(),
        transcript.transcriptJson(),
        transcript.utterances(),
        durationSeconds,
        language,
        transcript.wordCount(),
        transcript.speakerCount(),
        null,
        processingSeconds);
  }

  public static ResultEnvelope error(
      String recordingId, String error, double processingSeconds) {
    return new ResultEnvelope(
        recordingId, ERROR, null, null, null, null, null, null, null, error, processingSeconds);
  }

  @JsonIgnore
  public boolean isSuccess() {
    return SUCCESS.equals(status);
  }
}
