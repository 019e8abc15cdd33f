package com.scholary.transcriber.callback;

/**
 * Outcome of a single delivery attempt.
 *
 * @param delivered true when the receiver answered 2xx
 * @param statusCode the HTTP status, or -1 when no response arrived
 * @param error failure description, null on success
 */
public record DeliveryResult(boolean delivered, int statusCode, String error) {

  public static DeliveryResult ok(int statusCode) {
    return new DeliveryResult(true, statusCode, null);
  }

  public static DeliveryResult failed(int statusCode, String error) {
    return new DeliveryResult(false, statusCode, error);
  }
}
