package com.scholary.captions.error;

/** The finished subtitle file could not be written or published. */
public class PersistenceException extends CaptionException {

  public PersistenceException(String message) {
    super(ErrorKind.PERSISTENCE, message);
  }

  public PersistenceException(String message, Throwable cause) {
    super(ErrorKind.PERSISTENCE, message, cause);
  }
}
