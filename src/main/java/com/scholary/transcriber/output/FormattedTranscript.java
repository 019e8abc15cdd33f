package com.scholary.transcriber.output;

import java.util.List;

/**
 * The three transcript representations plus their derived counts.
 *
 * <p>{@code transcriptText} has one line per entry of {@code utterances}, in the same order, and
 * {@code transcriptJson.utterances()} is the same list.
 */
public record FormattedTranscript(
    String transcriptText,
    TranscriptJson transcriptJson,
    List<Utterance> utterances,
    int speakerCount,
    int wordCount) {}
