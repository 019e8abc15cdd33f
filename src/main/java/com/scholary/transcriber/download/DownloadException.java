package com.scholary.transcriber.download;

/**
 * Exception thrown when a job's media cannot be fetched.
 *
 * <p>Covers network errors, non-2xx responses and missing storage objects. Always fatal for the
 * job.
 */
public class DownloadException extends RuntimeException {

  public DownloadException(String message) {
    super(message);
  }

  public DownloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
