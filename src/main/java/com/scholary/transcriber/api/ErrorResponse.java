package com.scholary.transcriber.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/** Error body for rejected requests. Field errors are listed when validation failed. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(String error, Map<String, String> fields) {

  public static ErrorResponse of(String error) {
    return new ErrorResponse(error, Map.of());
  }
}
