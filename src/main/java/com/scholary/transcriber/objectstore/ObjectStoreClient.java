package com.scholary.transcriber.objectstore;

import java.io.InputStream;

/**
 * Abstraction for object storage reads.
 *
 * <p>Media referenced by a storage reference is read straight from the store with the service's own
 * credentials, so callers never need to hand us a presigned URL.
 */
public interface ObjectStoreClient extends AutoCloseable {

  /**
   * Retrieve an object as a stream.
   *
   * <p>The caller is responsible for closing the stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return an input stream for reading the object
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Get object metadata without downloading the content.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return object metadata
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  /** The configured endpoint, used to recognise storage URLs that point back at this store. */
  String endpoint();

  @Override
  void close();

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}
}
