package com.scholary.transcriber.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Response from the recognition server.
 *
 * <p>Contains a list of segments and the detected language.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(List<WhisperSegment> segments, String language) {}
