package com.scholary.transcriber.job;

/** Thrown when a job request has no usable source or is otherwise unusable. Rejected with 400. */
public class InvalidJobException extends RuntimeException {

  public InvalidJobException(String message) {
    super(message);
  }
}
