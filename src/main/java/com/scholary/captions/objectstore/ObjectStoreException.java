package com.scholary.captions.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Runtime because the caller cannot fix a missing bucket or bad credentials; the orchestrator
 * reports it as a persistence failure.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
