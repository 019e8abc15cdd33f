package com.scholary.transcriber.download;

import com.scholary.transcriber.objectstore.ObjectStoreClient;
import com.scholary.transcriber.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.transcriber.objectstore.ObjectStoreException;
import com.scholary.transcriber.objectstore.StorageReference;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves a job's media reference to a local file.
 *
 * <p>Storage references go straight to the object store. Everything else is fetched over HTTP and
 * streamed to disk, so a multi-gigabyte recording never has to fit in memory. An HTTP transfer that
 * makes no progress for {@code readTimeout} seconds is abandoned.
 */
@Component
public class MediaDownloader {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaDownloader.class);

  private final ObjectStoreClient objectStoreClient;
  private final DownloadProperties properties;
  private final HttpClient httpClient;

  public MediaDownloader(ObjectStoreClient objectStoreClient, DownloadProperties properties) {
    this.objectStoreClient = objectStoreClient;
    this.properties = properties;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
  }

  /**
   * Download a media reference to the given path.
   *
   * @param source a storage reference or an http(s) URL
   * @param destination where to write the bytes
   * @return the number of bytes written
   * @throws DownloadException if the transfer fails
   */
  public long download(String source, Path destination) {
    Optional<StorageReference> reference =
        StorageReference.parse(source, objectStoreClient.endpoint());
    long bytes =
        reference.isPresent()
            ? downloadFromStore(reference.get(), destination)
            : downloadFromUrl(source, destination);

    LOGGER.info("Downloaded {} bytes ({} MB) to {}", bytes, bytes / 1024 / 1024, destination);
    return bytes;
  }

  private long downloadFromStore(StorageReference reference, Path destination) {
    LOGGER.info("Downloading from object store: {}", reference);
    try {
      ObjectMetadata metadata =
          objectStoreClient.getObjectMetadata(reference.bucket(), reference.key());
      long bytes;
      try (InputStream in =
          objectStoreClient.getObjectStream(reference.bucket(), reference.key())) {
        bytes = copy(in, destination);
      }
      if (metadata.contentLength() >= 0 && bytes != metadata.contentLength()) {
        throw new DownloadException(
            String.format(
                "Storage download truncated for %s: got %d of %d bytes",
                reference, bytes, metadata.contentLength()));
      }
      return bytes;
    } catch (ObjectStoreException e) {
      throw new DownloadException(
          "Storage download failed for " + reference + ": " + e.getMessage(), e);
    } catch (IOException e) {
      throw new DownloadException("Storage download failed for " + reference, e);
    }
  }

  private long downloadFromUrl(String source, Path destination) {
    URI uri;
    try {
      uri = URI.create(source.trim());
    } catch (IllegalArgumentException e) {
      throw new DownloadException("Invalid media URL: " + source, e);
    }
    String scheme = uri.getScheme();
    if (scheme == null
        || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new DownloadException("Unsupported media URL scheme: " + source);
    }

    LOGGER.info("Downloading over HTTP: host={}", uri.getHost());

    HttpResponse<Path> response;
    try {
      response = awaitTransfer(uri, destination);
    } catch (IOException e) {
      throw new DownloadException("Download failed for " + uri.getHost() + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DownloadException("Download interrupted", e);
    }

    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new DownloadException(
          String.format("Download returned status %d for %s", response.statusCode(), uri.getHost()));
    }
    return sizeOf(destination);
  }

  /**
   * Stream the response body to disk, giving up once {@code readTimeout} passes without the file
   * growing. The request timeout alone stops applying as soon as headers arrive.
   */
  private HttpResponse<Path> awaitTransfer(URI uri, Path destination)
      throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .GET()
            .build();

    CompletableFuture<HttpResponse<Path>> transfer =
        httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofFile(destination));

    long lastSize = 0;
    while (true) {
      try {
        return transfer.get(properties.readTimeout(), TimeUnit.SECONDS);
      } catch (TimeoutException e) {
        long size = sizeOf(destination);
        if (size <= lastSize) {
          transfer.cancel(true);
          throw new DownloadException(
              String.format(
                  "Download stalled for %s: no data for %ds after %d bytes",
                  uri.getHost(), properties.readTimeout(), size));
        }
        LOGGER.debug("Download in progress: {} bytes", size);
        lastSize = size;
      } catch (InterruptedException e) {
        transfer.cancel(true);
        throw e;
      } catch (ExecutionException e) {
        if (e.getCause() instanceof IOException) {
          throw (IOException) e.getCause();
        }
        throw new IOException(e.getCause());
      }
    }
  }

  private static long sizeOf(Path file) {
    try {
      return Files.exists(file) ? Files.size(file) : 0L;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to stat " + file, e);
    }
  }

  private long copy(InputStream in, Path destination) throws IOException {
    byte[] buffer = new byte[properties.bufferSize()];
    long total = 0;
    try (OutputStream out = Files.newOutputStream(destination)) {
      int read;
      while ((read = in.read(buffer)) != -1) {
        out.write(buffer, 0, read);
        total += read;
      }
    }
    return total;
  }
}
