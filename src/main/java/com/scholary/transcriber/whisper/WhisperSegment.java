package com.scholary.transcriber.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Represents a single segment of transcribed audio as returned by the recognition server.
 *
 * <p>{@code words} is only populated when word timestamps were requested.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperSegment(double start, double end, String text, List<WhisperWord> words) {}
