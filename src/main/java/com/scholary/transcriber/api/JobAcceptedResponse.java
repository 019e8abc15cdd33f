package com.scholary.transcriber.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Acknowledgement for an accepted job. The result arrives later on the callback. */
public record JobAcceptedResponse(
    @JsonProperty("status") String status, @JsonProperty("recording_id") String recordingId) {

  public static JobAcceptedResponse accepted(String recordingId) {
    return new JobAcceptedResponse("accepted", recordingId);
  }
}
