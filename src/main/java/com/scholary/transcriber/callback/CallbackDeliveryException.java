package com.scholary.transcriber.callback;

/**
 * Exception raised when a webhook cannot be delivered.
 *
 * <p>Only used inside {@link CallbackNotifier}; delivery failures are logged, never propagated.
 */
public class CallbackDeliveryException extends RuntimeException {

  public CallbackDeliveryException(String message) {
    super(message);
  }

  public CallbackDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
