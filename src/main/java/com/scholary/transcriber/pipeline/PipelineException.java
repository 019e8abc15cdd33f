package com.scholary.transcriber.pipeline;

/** A fatal stage failure, tagged with the stage it happened in. */
public class PipelineException extends RuntimeException {

  private final PipelineStage stage;

  public PipelineException(PipelineStage stage, String message) {
    super(message);
    this.stage = stage;
  }

  public PipelineException(PipelineStage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }

  public PipelineStage getStage() {
    return stage;
  }
}
