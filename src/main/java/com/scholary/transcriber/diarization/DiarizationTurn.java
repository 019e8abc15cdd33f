package com.scholary.transcriber.diarization;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** The diarization engine's claim that {@code speaker} was talking over {@code [start, end]}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiarizationTurn(String speaker, double start, double end) {}
