package com.scholary.transcriber.output;

import java.util.List;

/**
 * The structured transcript sent as {@code transcript_json}.
 *
 * <p>{@code speakers} lists each speaker index with its utterance count, ascending by id.
 */
public record TranscriptJson(List<Utterance> utterances, List<SpeakerSummary> speakers) {

  public record SpeakerSummary(int id, int count) {}
}
