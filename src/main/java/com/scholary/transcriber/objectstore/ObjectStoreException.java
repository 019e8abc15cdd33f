package com.scholary.transcriber.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Missing objects and permission errors are not retryable; the downloader reports them as a
 * failed job.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
