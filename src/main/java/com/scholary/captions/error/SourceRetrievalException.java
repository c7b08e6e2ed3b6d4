package com.scholary.captions.error;

/** Caption or video content could not be fetched. */
public class SourceRetrievalException extends CaptionException {

  public SourceRetrievalException(String message) {
    super(ErrorKind.SOURCE_RETRIEVAL, message);
  }

  public SourceRetrievalException(String message, Throwable cause) {
    super(ErrorKind.SOURCE_RETRIEVAL, message, cause);
  }
}
