package com.scholary.transcriber.diarization;

import com.scholary.transcriber.transcription.Segment;

/** A transcript segment with the speaker label it was attributed to. */
public record DiarizedSegment(Segment segment, String speaker) {}
