package com.scholary.transcriber.objectstore;

import java.net.URI;
import java.util.Optional;

/**
 * A bucket/key pair pointing at an object in the store.
 *
 * <p>Recognised forms:
 *
 * <ul>
 *   <li>{@code s3://bucket/key}
 *   <li>path-style URLs on the configured endpoint: {@code http://minio:9000/bucket/key}
 *   <li>virtual-host URLs on the configured endpoint: {@code http://bucket.minio:9000/key}
 * </ul>
 */
public record StorageReference(String bucket, String key) {

  public StorageReference {
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("bucket must not be blank");
    }
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("key must not be blank");
    }
  }

  /**
   * Parse a source reference.
   *
   * @param source the media reference from the job
   * @param endpoint the configured object store endpoint, may be null
   * @return the storage reference, or empty when the source is a generic URL
   */
  public static Optional<StorageReference> parse(String source, String endpoint) {
    if (source == null || source.isBlank()) {
      return Optional.empty();
    }
    URI uri;
    try {
      uri = URI.create(source.trim());
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }

    if ("s3".equalsIgnoreCase(uri.getScheme())) {
      return fromParts(uri.getAuthority(), stripLeadingSlash(uri.getPath()));
    }

    if (endpoint == null || endpoint.isBlank() || uri.getHost() == null) {
      return Optional.empty();
    }
    URI endpointUri = URI.create(endpoint);
    if (endpointUri.getHost() == null || portOf(uri) != portOf(endpointUri)) {
      return Optional.empty();
    }

    String host = uri.getHost();
    String endpointHost = endpointUri.getHost();
    String path = stripLeadingSlash(uri.getPath());

    if (host.equalsIgnoreCase(endpointHost)) {
      int slash = path.indexOf('/');
      if (slash <= 0) {
        return Optional.empty();
      }
      return fromParts(path.substring(0, slash), path.substring(slash + 1));
    }
    String suffix = "." + endpointHost;
    if (host.toLowerCase().endsWith(suffix.toLowerCase())) {
      return fromParts(host.substring(0, host.length() - suffix.length()), path);
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return "s3://" + bucket + "/" + key;
  }

  private static Optional<StorageReference> fromParts(String bucket, String key) {
    if (bucket == null || bucket.isBlank() || key == null || key.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(new StorageReference(bucket, key));
  }

  private static String stripLeadingSlash(String path) {
    if (path == null) {
      return "";
    }
    return path.startsWith("/") ? path.substring(1) : path;
  }

  private static int portOf(URI uri) {
    if (uri.getPort() != -1) {
      return uri.getPort();
    }
    return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
  }
}
