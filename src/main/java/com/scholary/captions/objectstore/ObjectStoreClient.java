package com.scholary.captions.objectstore;

import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Abstraction for object storage operations.
 *
 * <p>Finished caption files can be published to S3-compatible storage and shared through a
 * presigned URL. Keeping this behind an interface lets tests mock storage away.
 */
public interface ObjectStoreClient {

  /**
   * Upload a local file.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param file the file to upload
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(String bucket, String key, Path file, String contentType);

  /**
   * Generate a presigned URL for temporary access to an object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param ttl time-to-live for the URL
   * @return a presigned URL
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(String bucket, String key, Duration ttl);
}
