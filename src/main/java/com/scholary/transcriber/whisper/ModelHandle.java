package com.scholary.transcriber.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A model the recognition server has loaded and keeps resident.
 *
 * @param model the model name the server loaded
 * @param device where it runs, e.g. {@code cuda} or {@code cpu}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelHandle(String model, String device) {}
