package com.scholary.transcriber.api;

import com.scholary.transcriber.job.InvalidJobException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps request rejections to error responses with a JSON body. Bad input is a 400. */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    Map<String, String> fields = new LinkedHashMap<>();
    for (FieldError error : ex.getBindingResult().getFieldErrors()) {
      fields.put(jsonName(error.getField()), error.getDefaultMessage());
    }
    LOGGER.warn("Rejected request, validation failed: {}", fields);
    return ResponseEntity.badRequest().body(new ErrorResponse("Validation failed", fields));
  }

  @ExceptionHandler(InvalidJobException.class)
  public ResponseEntity<ErrorResponse> handleInvalidJob(InvalidJobException ex) {
    LOGGER.warn("Rejected request: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(ErrorResponse.of(ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    LOGGER.warn("Rejected request, unreadable body: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(ErrorResponse.of("Malformed request body"));
  }

  @ExceptionHandler(TaskRejectedException.class)
  public ResponseEntity<ErrorResponse> handleQueueFull(TaskRejectedException ex) {
    LOGGER.warn("Rejected request, job queue is full");
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ErrorResponse.of("Job queue is full, retry later"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
    LOGGER.error("Unexpected error: {}", ex.getMessage(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of("An unexpected error occurred"));
  }

  /** Request fields are snake_case on the wire. */
  private static String jsonName(String field) {
    return field.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT);
  }
}
