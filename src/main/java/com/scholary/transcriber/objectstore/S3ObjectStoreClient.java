package com.scholary.transcriber.objectstore;

import java.io.InputStream;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>Uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO. The SDK
 * retries transient failures (network issues, 5xx, throttling) on its own; 404 and 403 fail fast.
 */
public class S3ObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;
  private final String endpoint;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    this.s3Client =
        S3Client.builder()
            .region(region)
            .credentialsProvider(StaticCredentialsProvider.create(credentials))
            .endpointOverride(URI.create(properties.endpoint()))
            .forcePathStyle(properties.pathStyleAccess()) // Required for MinIO
            .build();
    this.endpoint = properties.endpoint();
  }

  S3ObjectStoreClient(S3Client s3Client, String endpoint) {
    this.s3Client = s3Client;
    this.endpoint = endpoint;
  }

  @Override
  public InputStream getObjectStream(String bucket, String key) {
    LOGGER.debug("Fetching object: bucket={}, key={}", bucket, key);

    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
      InputStream stream = s3Client.getObject(request);

      LOGGER.info("Opened object stream: bucket={}, key={}", bucket, key);
      return stream;

    } catch (NoSuchKeyException e) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message);
      throw new ObjectStoreException(message, e);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to retrieve object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (RuntimeException e) {
      String message =
          String.format("Unexpected error retrieving object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public ObjectMetadata getObjectMetadata(String bucket, String key) {
    LOGGER.debug("Getting metadata for object: bucket={}, key={}", bucket, key);

    try {
      HeadObjectResponse response =
          s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());

      LOGGER.info(
          "Retrieved metadata: bucket={}, key={}, size={} bytes, contentType={}",
          bucket,
          key,
          response.contentLength(),
          response.contentType());

      long contentLength = response.contentLength() != null ? response.contentLength() : -1L;
      return new ObjectMetadata(contentLength, response.contentType());

    } catch (NoSuchKeyException e) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message);
      throw new ObjectStoreException(message, e);

    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
        LOGGER.error(message);
        throw new ObjectStoreException(message, e);
      }
      String message =
          String.format(
              "Failed to get metadata: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (RuntimeException e) {
      String message =
          String.format("Unexpected error getting metadata: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public String endpoint() {
    return endpoint;
  }

  /** Release connections and threads held by the SDK client. */
  @Override
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
