package com.scholary.transcriber.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.HttpWaitStrategy;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/** Runs the client against a MinIO container. Skipped when Docker is not available. */
@Testcontainers(disabledWithoutDocker = true)
class S3ObjectStoreClientTest {

  private static final String ACCESS_KEY = "minioadmin";
  private static final String SECRET_KEY = "minioadmin";
  private static final String BUCKET = "recordings";

  @Container
  static GenericContainer<?> minio =
      new GenericContainer<>("minio/minio:RELEASE.2024-10-13T13-34-11Z")
          .withExposedPorts(9000)
          .withEnv("MINIO_ROOT_USER", ACCESS_KEY)
          .withEnv("MINIO_ROOT_PASSWORD", SECRET_KEY)
          .withCommand("server /data")
          .waitingFor(new HttpWaitStrategy().forPath("/minio/health/ready").forPort(9000));

  private static S3ObjectStoreClient client;

  @BeforeAll
  static void setUp() {
    String endpoint = String.format("http://%s:%d", minio.getHost(), minio.getMappedPort(9000));
    client =
        new S3ObjectStoreClient(
            new ObjectStoreProperties(endpoint, ACCESS_KEY, SECRET_KEY, BUCKET, "us-east-1", true));

    try (S3Client admin =
        S3Client.builder()
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(ACCESS_KEY, SECRET_KEY)))
            .endpointOverride(URI.create(endpoint))
            .forcePathStyle(true)
            .build()) {
      admin.createBucket(CreateBucketRequest.builder().bucket(BUCKET).build());
      admin.putObject(
          PutObjectRequest.builder().bucket(BUCKET).key("meetings/standup.mp3").build(),
          RequestBody.fromString("fake mp3 bytes", StandardCharsets.UTF_8));
    }
  }

  @AfterAll
  static void tearDown() {
    if (client != null) {
      client.close();
    }
  }

  @Test
  void getObjectStream_shouldReturnObjectContent() throws Exception {
    try (InputStream in = client.getObjectStream(BUCKET, "meetings/standup.mp3")) {
      assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("fake mp3 bytes");
    }
  }

  @Test
  void getObjectMetadata_shouldReturnContentLength() {
    ObjectStoreClient.ObjectMetadata metadata =
        client.getObjectMetadata(BUCKET, "meetings/standup.mp3");

    assertThat(metadata.contentLength()).isEqualTo(14);
  }

  @Test
  void getObjectStream_shouldThrowForMissingObject() {
    assertThatThrownBy(() -> client.getObjectStream(BUCKET, "meetings/missing.mp3"))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessageContaining("Object not found");
  }

  @Test
  void getObjectMetadata_shouldThrowForMissingObject() {
    assertThatThrownBy(() -> client.getObjectMetadata(BUCKET, "meetings/missing.mp3"))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessageContaining("Object not found");
  }
}
