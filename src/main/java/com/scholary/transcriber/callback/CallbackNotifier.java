package com.scholary.transcriber.callback;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcriber.http.HttpExchanges;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Delivers a job's result to the caller's webhook.
 *
 * <p>The envelope is serialized once and the signature is computed over exactly those bytes. One
 * attempt only. Failures, including a receiver that does not finish its response within the timeout,
 * are logged and reported in the returned {@link DeliveryResult}, never thrown.
 */
@Component
public class CallbackNotifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(CallbackNotifier.class);

  private final ObjectMapper objectMapper;
  private final CallbackProperties properties;
  private final HttpClient httpClient;

  public CallbackNotifier(ObjectMapper objectMapper, CallbackProperties properties) {
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.timeoutSeconds()))
            .build();
  }

  /**
   * Send the envelope.
   *
   * @param url the webhook URL
   * @param secret the shared signing secret
   * @param envelope the result to deliver
   * @return what happened; never null
   */
  public DeliveryResult notify(String url, String secret, ResultEnvelope envelope) {
    try {
      DeliveryResult result = send(url, secret, envelope);
      LOGGER.info(
          "Callback delivered: status={}, envelope={}", result.statusCode(), envelope.status());
      return result;
    } catch (CallbackDeliveryException e) {
      LOGGER.error("Callback delivery failed: {}", e.getMessage());
      return DeliveryResult.failed(statusOf(e), e.getMessage());
    } catch (RuntimeException e) {
      LOGGER.error("Callback delivery failed unexpectedly", e);
      return DeliveryResult.failed(-1, e.getMessage());
    }
  }

  private DeliveryResult send(String url, String secret, ResultEnvelope envelope) {
    byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(envelope);
    } catch (JsonProcessingException e) {
      throw new CallbackDeliveryException("Failed to serialize result envelope", e);
    }

    HttpRequest request;
    try {
      request =
          HttpRequest.newBuilder(URI.create(url))
              .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
              .header("Content-Type", "application/json")
              .header(properties.signatureHeader(), CallbackSigner.sign(secret, body))
              .POST(BodyPublishers.ofByteArray(body))
              .build();
    } catch (IllegalArgumentException e) {
      throw new CallbackDeliveryException("Invalid callback URL: " + url, e);
    }

    HttpResponse<String> response;
    try {
      response =
          HttpExchanges.send(
              httpClient,
              request,
              HttpResponse.BodyHandlers.ofString(),
              Duration.ofSeconds(properties.timeoutSeconds()));
    } catch (IOException e) {
      throw new CallbackDeliveryException("Callback transport error: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CallbackDeliveryException("Callback interrupted", e);
    }

    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new StatusException(response.statusCode(), response.body());
    }
    return DeliveryResult.ok(response.statusCode());
  }

  private static int statusOf(CallbackDeliveryException e) {
    return e instanceof StatusException ? ((StatusException) e).statusCode : -1;
  }

  private static final class StatusException extends CallbackDeliveryException {
    private final int statusCode;

    StatusException(int statusCode, String body) {
      super(String.format("Callback returned status %d: %s", statusCode, body));
      this.statusCode = statusCode;
    }
  }
}
