package com.scholary.transcriber.http;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Request/response exchanges with a deadline on the whole exchange.
 *
 * <p>{@link HttpRequest#timeout()} only covers the wait for response headers. A server that sends
 * headers and then stalls would block {@link HttpClient#send} forever, so the exchange runs
 * asynchronously and is cancelled once the deadline passes.
 */
public final class HttpExchanges {

  private HttpExchanges() {}

  /**
   * Send a request and wait for the complete response, body included.
   *
   * @throws HttpTimeoutException if the response is not complete within {@code deadline}
   * @throws IOException on transport errors
   */
  public static <T> HttpResponse<T> send(
      HttpClient httpClient,
      HttpRequest request,
      HttpResponse.BodyHandler<T> bodyHandler,
      Duration deadline)
      throws IOException, InterruptedException {

    CompletableFuture<HttpResponse<T>> exchange = httpClient.sendAsync(request, bodyHandler);
    try {
      return exchange.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      exchange.cancel(true);
      throw new HttpTimeoutException(
          String.format(
              "No complete response from %s within %ds", request.uri(), deadline.toSeconds()));
    } catch (InterruptedException e) {
      exchange.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      throw unwrap(e);
    }
  }

  private static IOException unwrap(ExecutionException e) {
    Throwable cause = e.getCause();
    if (cause instanceof IOException) {
      return (IOException) cause;
    }
    if (cause instanceof RuntimeException) {
      throw (RuntimeException) cause;
    }
    return new IOException(cause);
  }
}
