package com.scholary.transcriber.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A single recognized word. Timestamps and probability may be missing. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperWord(String word, Double start, Double end, Double probability) {}
