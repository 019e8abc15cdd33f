package com.scholary.transcriber.diarization;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A diarization pipeline the server has loaded.
 *
 * @param pipeline the pipeline name
 * @param device where it runs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineHandle(String pipeline, String device) {}
