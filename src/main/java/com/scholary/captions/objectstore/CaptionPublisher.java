package com.scholary.captions.objectstore;

import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Uploads finished caption files and hands out presigned download links. */
public class CaptionPublisher {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptionPublisher.class);

  static final String ASS_CONTENT_TYPE = "text/x-ssa; charset=utf-8";

  private final ObjectStoreClient objectStoreClient;
  private final ObjectStoreProperties properties;

  public CaptionPublisher(ObjectStoreClient objectStoreClient, ObjectStoreProperties properties) {
    this.objectStoreClient = objectStoreClient;
    this.properties = properties;
  }

  /**
   * Upload a caption file under the configured key prefix.
   *
   * @param captionFile local {@code .ass} file
   * @return presigned GET URL for the uploaded object
   * @throws ObjectStoreException if upload or signing fails
   */
  public URL publish(Path captionFile) {
    String key = keyFor(captionFile.getFileName().toString());
    objectStoreClient.putObject(properties.bucket(), key, captionFile, ASS_CONTENT_TYPE);
    URL url =
        objectStoreClient.presignGet(
            properties.bucket(), key, Duration.ofMinutes(properties.presignTtlMinutes()));
    LOGGER.info("Published caption file: bucket={}, key={}", properties.bucket(), key);
    return url;
  }

  String keyFor(String filename) {
    String prefix = properties.keyPrefix();
    if (prefix == null || prefix.isBlank()) {
      return filename;
    }
    return prefix.endsWith("/") ? prefix + filename : prefix + "/" + filename;
  }
}
