package com.scholary.transcriber.download;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.transcriber.objectstore.ObjectStoreClient;
import com.scholary.transcriber.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.transcriber.objectstore.ObjectStoreException;
import com.sun.net.httpserver.HttpServer;
import java.io.ByteArrayInputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MediaDownloaderTest {

  private static final String ENDPOINT = "http://minio:9000";

  @Mock private ObjectStoreClient objectStoreClient;

  @TempDir Path tempDir;

  private final CountDownLatch releaseStalled = new CountDownLatch(1);

  private HttpServer server;
  private MediaDownloader downloader;
  private byte[] media;

  @BeforeEach
  void setUp() throws Exception {
    media = new byte[200_000];
    new Random(42).nextBytes(media);

    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/media/recording.mp3",
        exchange -> {
          exchange.sendResponseHeaders(200, media.length);
          exchange.getResponseBody().write(media);
          exchange.close();
        });
    server.createContext(
        "/media/missing.mp3",
        exchange -> {
          exchange.sendResponseHeaders(404, -1);
          exchange.close();
        });
    server.createContext(
        "/media/stalled.mp3",
        exchange -> {
          exchange.sendResponseHeaders(200, media.length);
          exchange.getResponseBody().write(media, 0, 1024);
          exchange.getResponseBody().flush();
          try {
            releaseStalled.await(30, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          exchange.close();
        });
    server.setExecutor(Executors.newCachedThreadPool());
    server.start();

    when(objectStoreClient.endpoint()).thenReturn(ENDPOINT);
    downloader = new MediaDownloader(objectStoreClient, new DownloadProperties(5, 30, 8192));
  }

  @AfterEach
  void tearDown() {
    releaseStalled.countDown();
    server.stop(0);
  }

  private String url(String path) {
    return "http://127.0.0.1:" + server.getAddress().getPort() + path;
  }

  @Test
  void download_shouldStreamHttpBodyToDisk() throws Exception {
    Path destination = tempDir.resolve("input.media");

    long bytes = downloader.download(url("/media/recording.mp3"), destination);

    assertThat(bytes).isEqualTo(media.length);
    assertThat(Files.readAllBytes(destination)).isEqualTo(media);
  }

  @Test
  void download_shouldFailOnNon2xxStatus() {
    assertThatThrownBy(
            () -> downloader.download(url("/media/missing.mp3"), tempDir.resolve("input.media")))
        .isInstanceOf(DownloadException.class)
        .hasMessageContaining("status 404");
  }

  @Test
  void download_shouldRejectUnsupportedScheme() {
    assertThatThrownBy(
            () -> downloader.download("ftp://files.example.com/a.mp3", tempDir.resolve("x")))
        .isInstanceOf(DownloadException.class)
        .hasMessageContaining("Unsupported");
  }

  @Test
  void download_shouldFetchStorageReferenceFromObjectStore() throws Exception {
    byte[] content = {1, 2, 3, 4, 5};
    when(objectStoreClient.getObjectMetadata("recordings", "2024/05/meeting.webm"))
        .thenReturn(new ObjectMetadata(content.length, "video/webm"));
    when(objectStoreClient.getObjectStream("recordings", "2024/05/meeting.webm"))
        .thenReturn(new ByteArrayInputStream(content));
    Path destination = tempDir.resolve("input.media");

    long bytes = downloader.download("s3://recordings/2024/05/meeting.webm", destination);

    assertThat(bytes).isEqualTo(5);
    assertThat(Files.readAllBytes(destination)).isEqualTo(content);
  }

  @Test
  void download_shouldTreatEndpointUrlAsStorageReference() throws Exception {
    byte[] content = {9, 9};
    when(objectStoreClient.getObjectMetadata("recordings", "a.wav"))
        .thenReturn(new ObjectMetadata(content.length, "audio/wav"));
    when(objectStoreClient.getObjectStream("recordings", "a.wav"))
        .thenReturn(new ByteArrayInputStream(content));

    long bytes = downloader.download(ENDPOINT + "/recordings/a.wav", tempDir.resolve("in"));

    assertThat(bytes).isEqualTo(2);
  }

  @Test
  void download_shouldWrapMissingObject() {
    when(objectStoreClient.getObjectMetadata("recordings", "gone.mp3"))
        .thenThrow(new ObjectStoreException("Object not found: bucket=recordings, key=gone.mp3"));

    assertThatThrownBy(
            () -> downloader.download("s3://recordings/gone.mp3", tempDir.resolve("in")))
        .isInstanceOf(DownloadException.class)
        .hasMessageContaining("Object not found")
        .hasCauseInstanceOf(ObjectStoreException.class);
    verify(objectStoreClient, never()).getObjectStream("recordings", "gone.mp3");
  }

  @Test
  void download_shouldDetectTruncatedObject() {
    when(objectStoreClient.getObjectMetadata("recordings", "short.mp3"))
        .thenReturn(new ObjectMetadata(10, "audio/mpeg"));
    when(objectStoreClient.getObjectStream("recordings", "short.mp3"))
        .thenReturn(new ByteArrayInputStream(new byte[4]));

    assertThatThrownBy(
            () -> downloader.download("s3://recordings/short.mp3", tempDir.resolve("in")))
        .isInstanceOf(DownloadException.class)
        .hasMessageContaining("truncated");
  }

  @Test
  void download_shouldAbandonTransferThatStopsMakingProgress() {
    MediaDownloader impatient =
        new MediaDownloader(objectStoreClient, new DownloadProperties(5, 1, 8192));

    long started = System.nanoTime();
    assertThatThrownBy(
            () -> impatient.download(url("/media/stalled.mp3"), tempDir.resolve("input.media")))
        .isInstanceOf(DownloadException.class)
        .hasMessageContaining("stalled");
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

    assertThat(elapsedMillis).isLessThan(10_000);
  }
}
