package com.scholary.transcriber.diarization;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Response from the diarization server. */
@JsonIgnoreProperties(ignoreUnknown = true)
record DiarizationResponse(List<DiarizationTurn> turns) {}
